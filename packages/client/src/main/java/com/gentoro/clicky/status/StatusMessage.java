package com.gentoro.clicky.status;

import java.time.Instant;

/** A line shown in the status area; {@code error} selects the error styling. */
public record StatusMessage(String text, boolean error, Instant timestamp) {}
