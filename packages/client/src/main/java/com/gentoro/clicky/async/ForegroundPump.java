package com.gentoro.clicky.async;

import com.gentoro.clicky.exception.StateException;
import java.util.Objects;

/**
 * Drains the {@link DeliveryQueue} on the foreground thread. The host loop calls {@link #pump()}
 * once per iteration; continuations therefore never run on any other thread.
 */
public final class ForegroundPump {
  private final DeliveryQueue queue;
  private final Thread foreground;

  /** Bind the pump to the calling thread. */
  public ForegroundPump(DeliveryQueue queue) {
    this(queue, Thread.currentThread());
  }

  public ForegroundPump(DeliveryQueue queue, Thread foreground) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.foreground = Objects.requireNonNull(foreground, "foreground");
  }

  /**
   * Run every delivered continuation.
   *
   * @return number of continuations run
   * @throws StateException if called from a thread other than the foreground thread
   */
  public int pump() {
    if (!isForegroundThread()) {
      throw new StateException(
          "pump() called from "
              + Thread.currentThread().getName()
              + ", expected foreground thread "
              + foreground.getName());
    }
    if (queue.isEmpty()) {
      return 0;
    }
    return queue.drainAndRun();
  }

  public boolean isForegroundThread() {
    return Thread.currentThread() == foreground;
  }

  public Thread foregroundThread() {
    return foreground;
  }
}
