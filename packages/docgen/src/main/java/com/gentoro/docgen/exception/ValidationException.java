package com.gentoro.docgen.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends DocGenException {
  public ValidationException(String message) {
    super(DocGenErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(DocGenErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Throwable cause) {
    super(DocGenErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
