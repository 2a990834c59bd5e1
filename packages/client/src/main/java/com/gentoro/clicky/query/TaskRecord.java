package com.gentoro.clicky.query;

import com.gentoro.clicky.exception.ErrorDetails;
import com.gentoro.clicky.exception.StateException;
import java.time.Duration;
import java.util.Optional;

/**
 * One unit of single-flight work and its outcome. Owned by {@link QueryExecutor}; transitions
 * follow {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED} and are final once
 * terminal.
 *
 * <p>The cancellation signal is set from the foreground thread and read from the background
 * thread; status and signal are guarded by this record's monitor, so a cancel accepted by {@link
 * #requestCancel()} can never be followed by {@code COMPLETED}.
 */
public final class TaskRecord<T> {
  private final long id;

  private TaskStatus status = TaskStatus.PENDING;
  private boolean cancelRequested;
  private T result; // may be null
  private String error; // may be null
  private ErrorDetails errorDetails; // may be null
  private Duration elapsed = Duration.ZERO;

  TaskRecord(long id) {
    this.id = id;
  }

  public long id() {
    return id;
  }

  public synchronized TaskStatus status() {
    return status;
  }

  public synchronized Optional<T> result() {
    return Optional.ofNullable(result);
  }

  public synchronized Optional<String> error() {
    return Optional.ofNullable(error);
  }

  /** Structured form of the failure, present only for {@link TaskStatus#FAILED}. */
  public synchronized Optional<ErrorDetails> errorDetails() {
    return Optional.ofNullable(errorDetails);
  }

  public synchronized Duration elapsed() {
    return elapsed;
  }

  public synchronized boolean isCancelRequested() {
    return cancelRequested;
  }

  public synchronized boolean isTerminal() {
    return status.isTerminal();
  }

  /**
   * Set the cancellation signal unless the task already reached a terminal state.
   *
   * @return whether the signal was accepted
   */
  synchronized boolean requestCancel() {
    if (status.isTerminal()) {
      return false;
    }
    cancelRequested = true;
    return true;
  }

  synchronized void markRunning() {
    transition(TaskStatus.PENDING, TaskStatus.RUNNING);
  }

  /**
   * Finish a normal return: {@code CANCELLED} if the signal is set, {@code COMPLETED} with the
   * value otherwise.
   *
   * @return whether the task completed
   */
  synchronized boolean completeUnlessCancelled(T value, Duration took) {
    if (cancelRequested) {
      markCancelled(took);
      return false;
    }
    transition(TaskStatus.RUNNING, TaskStatus.COMPLETED);
    this.result = value;
    this.elapsed = took;
    return true;
  }

  synchronized void markFailed(String description, ErrorDetails details, Duration took) {
    transition(TaskStatus.RUNNING, TaskStatus.FAILED);
    this.error = description;
    this.errorDetails = details;
    this.elapsed = took;
  }

  synchronized void markCancelled(Duration took) {
    transition(TaskStatus.RUNNING, TaskStatus.CANCELLED);
    this.elapsed = took;
  }

  private void transition(TaskStatus expected, TaskStatus next) {
    if (status != expected) {
      throw new StateException("Task " + id + " cannot move from " + status + " to " + next);
    }
    status = next;
  }

  @Override
  public synchronized String toString() {
    return "TaskRecord{id=" + id + ", status=" + status + ", elapsed=" + elapsed + "}";
  }
}
