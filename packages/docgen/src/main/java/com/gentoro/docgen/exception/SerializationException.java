package com.gentoro.docgen.exception;

/**
 * A documentation fragment is not well-formed XML, a referenced example constant is not valid
 * JSON or YAML, or an OpenAPI document cannot be read or rendered.
 */
public class SerializationException extends DocGenException {
  public SerializationException(String message) {
    super(DocGenErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(DocGenErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
