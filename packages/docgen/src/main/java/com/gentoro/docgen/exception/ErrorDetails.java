package com.gentoro.docgen.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error information reported per failed fragment. */
public record ErrorDetails(
    String type,
    String message,
    DocGenErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
