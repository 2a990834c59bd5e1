package com.gentoro.clicky.exception;

/** Coarse classification of failures raised by the client core. */
public enum ClickyErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  TASK_ERROR
}
