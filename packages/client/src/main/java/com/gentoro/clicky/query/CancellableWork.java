package com.gentoro.clicky.query;

/** Work executed by {@link QueryExecutor} on its background thread. */
@FunctionalInterface
public interface CancellableWork<T> {
  /** Runs on the background thread; must not touch foreground-only state. */
  T execute(CancellationToken cancellation, ProgressReporter progress) throws Exception;

  interface ProgressReporter {
    void report(String message);
  }
}
