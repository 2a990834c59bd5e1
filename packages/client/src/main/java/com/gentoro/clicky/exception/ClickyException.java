package com.gentoro.clicky.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base unchecked exception of the client, carrying an error code and optional context. */
public class ClickyException extends RuntimeException {
  private final ClickyErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ClickyException(ClickyErrorCode code, String message) {
    super(message);
    this.code = code == null ? ClickyErrorCode.UNKNOWN : code;
  }

  public ClickyException(ClickyErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? ClickyErrorCode.UNKNOWN : code;
  }

  public ClickyErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a key/value pair that ends up in {@link ErrorDetails}. */
  public ClickyException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
