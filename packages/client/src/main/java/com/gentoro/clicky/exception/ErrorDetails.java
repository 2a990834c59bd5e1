package com.gentoro.clicky.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened view of a failure, suitable for logs and the status board. */
public record ErrorDetails(
    String type,
    String message,
    ClickyErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
