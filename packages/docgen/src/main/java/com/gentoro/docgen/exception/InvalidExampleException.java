package com.gentoro.docgen.exception;

import java.util.Map;

/** An {@code <example>} tag is structurally invalid. */
public class InvalidExampleException extends ValidationException {
  public InvalidExampleException(String message) {
    super(message);
  }

  public InvalidExampleException(String message, Map<String, ?> context) {
    super(message, context);
  }
}
