package com.gentoro.clicky.async;

import com.gentoro.clicky.logging.LoggingService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/** Creates named daemon threads so background work never keeps the process alive. */
public final class WorkerThreadFactory implements ThreadFactory {
  private static final Logger log = LoggingService.getLogger(WorkerThreadFactory.class);

  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger();

  public WorkerThreadFactory(String prefix) {
    this.prefix = prefix == null || prefix.isBlank() ? "clicky-worker" : prefix;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, prefix + "-" + sequence.incrementAndGet());
    t.setDaemon(true);
    t.setUncaughtExceptionHandler(
        (thread, e) -> log.error("Uncaught failure on {}", thread.getName(), e));
    return t;
  }
}
