package com.gentoro.docgen.exception;

import java.util.Map;

/** Resource requested was not found. */
public class NotFoundException extends DocGenException {
  public NotFoundException(String message) {
    super(DocGenErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(DocGenErrorCode.NOT_FOUND, message, context);
  }

  public NotFoundException(String message, Map<String, ?> context, Throwable cause) {
    super(DocGenErrorCode.NOT_FOUND, message, context, cause);
  }
}
