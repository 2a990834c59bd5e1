package com.gentoro.clicky.query;

import com.gentoro.clicky.async.DeliveryQueue;
import com.gentoro.clicky.async.WorkerThreadFactory;
import com.gentoro.clicky.exception.ClickyErrorCode;
import com.gentoro.clicky.exception.ClickyException;
import com.gentoro.clicky.exception.ErrorDetails;
import com.gentoro.clicky.exception.ExceptionUtil;
import com.gentoro.clicky.logging.LoggingService;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Single-flight executor for query work: at most one task runs at a time, further submissions
 * are rejected rather than queued, and cancellation is cooperative.
 *
 * <p>Progress and completion are both delivered through the {@link DeliveryQueue}, so they run
 * on the foreground thread and progress messages always precede the completion of their task.
 */
public final class QueryExecutor {
  private static final Logger log = LoggingService.getLogger(QueryExecutor.class);

  private final DeliveryQueue queue;
  private final ThreadFactory threadFactory;
  private final AtomicLong ids = new AtomicLong();
  private final Object lock = new Object();

  // guarded by lock
  private Thread currentThread;
  private TaskRecord<?> current;

  public QueryExecutor(DeliveryQueue queue) {
    this(queue, new WorkerThreadFactory("clicky-query"));
  }

  public QueryExecutor(DeliveryQueue queue, ThreadFactory threadFactory) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
  }

  /** Variant for work that neither polls for cancellation nor reports progress. */
  public <T> boolean executeAsync(Callable<T> work, Consumer<? super TaskRecord<T>> onComplete) {
    Objects.requireNonNull(work, "work");
    return executeAsync((token, progress) -> work.call(), onComplete, null);
  }

  /**
   * Start {@code work} unless a previous task's thread is still alive.
   *
   * @param work the work to run on the background thread
   * @param onComplete receives the terminal record on the foreground thread, exactly once
   * @param onProgress optional; receives status text on the foreground thread
   * @return {@code true} if accepted, {@code false} if rejected because a task is running. A task
   *     whose thread cannot be started is accepted and completes as {@link TaskStatus#FAILED}.
   */
  public <T> boolean executeAsync(
      CancellableWork<T> work,
      Consumer<? super TaskRecord<T>> onComplete,
      Consumer<String> onProgress) {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(onComplete, "onComplete");

    synchronized (lock) {
      if (currentThread != null && currentThread.isAlive()) {
        log.debug("Rejected submission, task {} is still running", current.id());
        return false;
      }
      TaskRecord<T> record = new TaskRecord<>(ids.incrementAndGet());
      record.markRunning();
      current = record;
      try {
        Thread thread = threadFactory.newThread(() -> run(record, work, onComplete, onProgress));
        if (thread == null) {
          throw new IllegalStateException("Thread factory rejected the task");
        }
        currentThread = thread;
        thread.start();
        log.debug("Started query task {} on {}", record.id(), thread.getName());
      } catch (RuntimeException | OutOfMemoryError e) {
        currentThread = null;
        log.error("Could not start query task {}: {}", record.id(), e.toString());
        ClickyException failure =
            new ClickyException(
                    ClickyErrorCode.TASK_ERROR,
                    "Could not start query task: " + ExceptionUtil.extractErrorMessage(e),
                    e)
                .withContext("taskId", record.id());
        record.markFailed(
            failure.getMessage(), ExceptionUtil.toErrorDetails(failure), Duration.ZERO);
        queue.push(() -> onComplete.accept(record));
      }
      return true;
    }
  }

  private <T> void run(
      TaskRecord<T> r,
      CancellableWork<T> work,
      Consumer<? super TaskRecord<T>> onComplete,
      Consumer<String> onProgress) {
    long start = System.nanoTime();
    CancellableWork.ProgressReporter progress =
        message -> {
          if (onProgress != null) {
            queue.push(() -> onProgress.accept(message));
          }
        };
    try {
      if (r.isCancelRequested()) {
        // cancelled before start
        r.markCancelled(since(start));
        return;
      }
      progress.report("Executing query...");
      T value = work.execute(r::isCancelRequested, progress);
      if (r.completeUnlessCancelled(value, since(start))) {
        progress.report(
            String.format(Locale.ROOT, "Query completed in %.2fs", seconds(r.elapsed())));
      }
    } catch (Throwable e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      if (r.isCancelRequested()
          && (e instanceof CancellationException || e instanceof InterruptedException)) {
        r.markCancelled(since(start));
      } else {
        String description = ExceptionUtil.extractErrorMessage(e);
        ErrorDetails details = ExceptionUtil.toErrorDetails(e, ClickyErrorCode.TASK_ERROR);
        log.warn("Query task {} failed [{}]: {}", r.id(), details.code(), description);
        r.markFailed(description, details, since(start));
        progress.report("Query failed: " + description);
      }
    } finally {
      queue.push(() -> onComplete.accept(r));
    }
  }

  /**
   * Flag the running task as cancelled. The thread is not interrupted; the work finishes or
   * notices the flag on its own. An accepted cancel is always reported as {@link
   * TaskStatus#CANCELLED}, unless the work itself fails with an unrelated exception.
   *
   * @return whether a live, not yet finished task accepted the signal
   */
  public boolean cancelCurrent() {
    synchronized (lock) {
      if (currentThread == null || !currentThread.isAlive()) {
        return false;
      }
      boolean accepted = current.requestCancel();
      log.debug("Cancellation for query task {} accepted: {}", current.id(), accepted);
      return accepted;
    }
  }

  public boolean isRunning() {
    synchronized (lock) {
      return currentThread != null && currentThread.isAlive();
    }
  }

  /** The most recently started task, running or finished. */
  public Optional<TaskRecord<?>> currentTask() {
    synchronized (lock) {
      return Optional.ofNullable(current);
    }
  }

  private static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  public static double seconds(Duration d) {
    return d.toNanos() / 1_000_000_000.0;
  }
}
