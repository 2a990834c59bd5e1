package com.gentoro.clicky.async;

import com.gentoro.clicky.exception.ClickyErrorCode;
import com.gentoro.clicky.exception.ClickyException;
import com.gentoro.clicky.exception.ExceptionUtil;
import com.gentoro.clicky.logging.LoggingService;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Runs blocking work on a fresh background thread per task and delivers its outcome to the
 * foreground thread through a {@link DeliveryQueue}.
 *
 * <p>Exactly one of the success or failure continuations is delivered per submission. There is
 * no admission control and no cancellation; {@link #isBusy()} reports whether any submitted work
 * has not finished yet.
 */
public final class TaskDispatcher {
  private static final Logger log = LoggingService.getLogger(TaskDispatcher.class);

  private final DeliveryQueue queue;
  private final ThreadFactory threadFactory;
  private final Object lock = new Object();
  private int inFlight; // guarded by lock

  public TaskDispatcher(DeliveryQueue queue) {
    this(queue, new WorkerThreadFactory("clicky-worker"));
  }

  public TaskDispatcher(DeliveryQueue queue, ThreadFactory threadFactory) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
  }

  /** Submit work whose failures are only logged. */
  public <T> Thread submit(Callable<T> work, Consumer<? super T> onSuccess) {
    return submit(
        work,
        onSuccess,
        e -> log.warn("Background task failed: {}", ExceptionUtil.extractErrorMessage(e)));
  }

  /**
   * Start {@code work} on a new background thread and return immediately.
   *
   * @param work blocking work; must not touch foreground-only state
   * @param onSuccess receives the result on the foreground thread
   * @param onError receives the failure on the foreground thread
   * @return the started thread, or {@code null} if no thread could be started (in which case
   *     {@code onError} has been queued with a {@link ClickyErrorCode#TASK_ERROR} exception whose
   *     cause is the start failure)
   */
  public <T> Thread submit(
      Callable<T> work, Consumer<? super T> onSuccess, Consumer<? super Throwable> onError) {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(onSuccess, "onSuccess");
    Objects.requireNonNull(onError, "onError");

    synchronized (lock) {
      inFlight++;
    }
    try {
      Thread thread = threadFactory.newThread(() -> runTask(work, onSuccess, onError));
      if (thread == null) {
        throw new IllegalStateException("Thread factory rejected the task");
      }
      thread.start();
      log.debug("Started background task on {}", thread.getName());
      return thread;
    } catch (RuntimeException | OutOfMemoryError e) {
      synchronized (lock) {
        inFlight--;
      }
      log.error("Could not start background task: {}", e.toString());
      ClickyException failure =
          new ClickyException(
              ClickyErrorCode.TASK_ERROR,
              "Could not start background task: " + ExceptionUtil.extractErrorMessage(e),
              e);
      queue.push(() -> onError.accept(failure));
      return null;
    }
  }

  private <T> void runTask(
      Callable<T> work, Consumer<? super T> onSuccess, Consumer<? super Throwable> onError) {
    try {
      T result = work.call();
      queue.push(() -> onSuccess.accept(result));
    } catch (Throwable e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.debug("Background task failed: {}", ExceptionUtil.extractErrorMessage(e));
      queue.push(() -> onError.accept(e));
    } finally {
      synchronized (lock) {
        inFlight--;
      }
    }
  }

  /**
   * True while at least one submitted task has not finished, i.e. from submission until its
   * continuation has been enqueued on the {@link DeliveryQueue}. It does not cover the time the
   * continuation then waits for the next pump: once this returns false every continuation is in
   * the queue, but may not have run yet.
   */
  public boolean isBusy() {
    synchronized (lock) {
      return inFlight > 0;
    }
  }

  public int inFlightCount() {
    synchronized (lock) {
      return inFlight;
    }
  }
}
