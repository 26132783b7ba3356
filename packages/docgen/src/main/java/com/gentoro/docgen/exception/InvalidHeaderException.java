package com.gentoro.docgen.exception;

import java.util.Map;

/** A {@code <header>} tag is structurally invalid. */
public class InvalidHeaderException extends ValidationException {
  public InvalidHeaderException(String message) {
    super(message);
  }

  public InvalidHeaderException(String message, Map<String, ?> context) {
    super(message, context);
  }
}
