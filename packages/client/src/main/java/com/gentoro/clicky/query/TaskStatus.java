package com.gentoro.clicky.query;

/** Lifecycle state of a single-flight task. */
public enum TaskStatus {
  /** Record created, thread not started yet. */
  PENDING,
  /** Background thread started. */
  RUNNING,
  /** Work returned normally and no cancellation was requested. */
  COMPLETED,
  /** Work threw. See the error description. */
  FAILED,
  /** Cancellation was requested; any result was discarded. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
