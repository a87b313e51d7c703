package com.gentoro.reformat.exception;

import java.time.Instant;
import java.util.Map;

/** Serializable snapshot of an error, used in run reports and logs. */
public record ErrorDetails(
    String type,
    String message,
    ReformatErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
