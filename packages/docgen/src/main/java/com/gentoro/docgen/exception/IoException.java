package com.gentoro.docgen.exception;

/** Reading a fragment file or an assembly, or writing the generated document, failed. */
public class IoException extends DocGenException {
  public IoException(String message) {
    super(DocGenErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(DocGenErrorCode.IO_ERROR, message, cause);
  }
}
