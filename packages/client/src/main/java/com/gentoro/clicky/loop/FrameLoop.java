package com.gentoro.clicky.loop;

import com.gentoro.clicky.async.ForegroundPump;
import com.gentoro.clicky.exception.ExceptionUtil;
import com.gentoro.clicky.exception.StateException;
import com.gentoro.clicky.logging.LoggingService;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * The host render loop. Each frame drains delivered continuations, runs the per-frame hooks and
 * renders, then sleeps for the rest of the frame interval.
 */
public final class FrameLoop {
  private static final Logger log = LoggingService.getLogger(FrameLoop.class);

  private final ForegroundPump pump;
  private final FrameRenderer renderer;
  private final Duration frameInterval;
  private final List<Runnable> frameHooks = new CopyOnWriteArrayList<>();
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicLong frames = new AtomicLong();

  public FrameLoop(ForegroundPump pump, FrameRenderer renderer, Duration frameInterval) {
    this.pump = Objects.requireNonNull(pump, "pump");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.frameInterval =
        frameInterval == null || frameInterval.isNegative() ? Duration.ZERO : frameInterval;
  }

  /** Register a callback run on the foreground thread every frame, after the pump. */
  public void addFrameHook(Runnable hook) {
    frameHooks.add(Objects.requireNonNull(hook, "hook"));
  }

  /**
   * Run a single frame on the calling thread.
   *
   * @return the renderer's verdict: {@code false} once the window is gone
   */
  public boolean runFrame() {
    pump.pump();
    for (Runnable hook : frameHooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        log.error("Frame hook failed: {}", ExceptionUtil.extractErrorMessage(e));
      }
    }
    frames.incrementAndGet();
    return renderer.renderFrame();
  }

  /** Loop until the renderer reports the window closed or {@link #stop()} is called. */
  public void run() {
    if (!pump.isForegroundThread()) {
      throw new StateException("Frame loop must run on the foreground thread");
    }
    if (!running.compareAndSet(false, true)) {
      throw new StateException("Frame loop is already running");
    }
    log.info("Frame loop started, interval {} ms", frameInterval.toMillis());
    try {
      while (!stopRequested.get()) {
        long start = System.nanoTime();
        if (!runFrame()) {
          log.info("Renderer closed, leaving frame loop");
          break;
        }
        long remaining = frameInterval.toNanos() - (System.nanoTime() - start);
        if (remaining > 0 && !stopRequested.get()) {
          TimeUnit.NANOSECONDS.sleep(remaining);
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.info("Frame loop interrupted");
    } finally {
      running.set(false);
      log.info("Frame loop stopped after {} frames", frames.get());
    }
  }

  /** Ask the loop to exit after the current frame. Callable from any thread. */
  public void stop() {
    stopRequested.set(true);
  }

  public boolean isRunning() {
    return running.get();
  }

  public long frameCount() {
    return frames.get();
  }
}
