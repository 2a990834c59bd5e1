package com.gentoro.clicky.exception;

/** An operation was invoked from the wrong thread or while the component was in the wrong state. */
public class StateException extends ClickyException {
  public StateException(String message) {
    super(ClickyErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(ClickyErrorCode.STATE_ERROR, message, cause);
  }
}
