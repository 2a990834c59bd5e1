package com.gentoro.clicky.exception;

/** Configuration could not be located or parsed. */
public class ConfigException extends ClickyException {
  public ConfigException(String message) {
    super(ClickyErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ClickyErrorCode.CONFIG_ERROR, message, cause);
  }
}
