package com.gentoro.clicky.query;

import java.util.concurrent.CancellationException;

/**
 * Checked by long-running work to cooperatively stop. Polling is best effort: work that never
 * checks runs to completion, and its result is then discarded.
 */
@FunctionalInterface
public interface CancellationToken {
  boolean isCancelled();

  default void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException("Cancelled by user request");
    }
  }
}
