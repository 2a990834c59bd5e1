package com.gentoro.clicky.async;

import com.gentoro.clicky.exception.ExceptionUtil;
import com.gentoro.clicky.logging.LoggingService;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Unbounded FIFO of continuations handed from background threads to the foreground thread.
 *
 * <p>Any thread may {@link #push(Runnable)}. Only the foreground thread drains, normally through
 * {@link ForegroundPump}. Producers never run continuations themselves.
 */
public final class DeliveryQueue {
  private static final Logger log = LoggingService.getLogger(DeliveryQueue.class);

  private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
  private final AtomicLong failures = new AtomicLong();

  /** Enqueue a continuation. Never blocks. */
  public void push(Runnable continuation) {
    pending.offer(Objects.requireNonNull(continuation, "continuation"));
  }

  /**
   * Run pending continuations on the calling thread until the queue is empty. Continuations
   * pushed while draining, including by a running continuation, are run by the same call.
   *
   * <p>A continuation throwing a {@link RuntimeException} is logged and skipped; the remaining
   * continuations still run.
   *
   * @return number of continuations run
   */
  public int drainAndRun() {
    int ran = 0;
    Runnable next;
    while ((next = pending.poll()) != null) {
      ran++;
      try {
        next.run();
      } catch (RuntimeException e) {
        failures.incrementAndGet();
        log.error(
            "Continuation failed: {} at {}",
            ExceptionUtil.extractErrorMessage(e),
            ExceptionUtil.formatCompactStackTrace(e));
      }
    }
    return ran;
  }

  public boolean isEmpty() {
    return pending.isEmpty();
  }

  /** Approximate number of pending continuations; O(n). */
  public int size() {
    return pending.size();
  }

  /** Total number of continuations that threw while being drained. */
  public long failureCount() {
    return failures.get();
  }
}
