package com.gentoro.clicky.exception;

import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * ClickyException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    return toErrorDetails(t, ClickyErrorCode.UNKNOWN);
  }

  /** As {@link #toErrorDetails(Throwable)}, classifying foreign throwables with {@code code}. */
  public static ErrorDetails toErrorDetails(Throwable t, ClickyErrorCode code) {
    if (t instanceof ClickyException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        code == null ? ClickyErrorCode.UNKNOWN : code,
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a user-facing description of a failure, without stack trace information.
   *
   * <p>Wrapper exceptions that only repeat their cause (such as {@code ExecutionException} or
   * {@code CompletionException}) are unwrapped first. The result is {@code "Type: message"}, or
   * just the simple type name when there is no message.
   *
   * @param t the throwable to describe
   * @return the description, or {@code "Unknown error"} for {@code null}
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    while (isWrapper(current) && current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String className = current.getClass().getSimpleName();
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return className;
    }
    return className + ": " + message.trim();
  }

  private static boolean isWrapper(Throwable t) {
    return t instanceof java.util.concurrent.ExecutionException
        || t instanceof java.util.concurrent.CompletionException
        || t instanceof java.lang.reflect.InvocationTargetException;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
