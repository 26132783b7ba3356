package com.gentoro.docgen.exception;

/**
 * The generator's YAML configuration cannot be loaded or holds an unsupported value, such as an
 * unknown {@code docgen.schema.property-naming} strategy.
 */
public class ConfigException extends DocGenException {
  public ConfigException(String message) {
    super(DocGenErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DocGenErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
