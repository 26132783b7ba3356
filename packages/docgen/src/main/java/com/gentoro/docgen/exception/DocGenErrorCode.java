package com.gentoro.docgen.exception;

/**
 * Stable error codes reported by the generator. A fragment failure is either {@link
 * #INVALID_ARGUMENT} (malformed fragment) or {@link #NOT_FOUND} (unresolvable reference); the
 * remaining codes cover the surrounding tooling.
 */
public enum DocGenErrorCode {
  UNKNOWN,
  INVALID_ARGUMENT,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
}
