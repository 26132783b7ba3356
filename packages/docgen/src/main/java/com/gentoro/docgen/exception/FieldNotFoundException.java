package com.gentoro.docgen.exception;

import java.util.Map;

/** A field cross-reference resolved its type but the type has no such public static field. */
public class FieldNotFoundException extends NotFoundException {
  private final String fieldName;
  private final String typeName;

  public FieldNotFoundException(String fieldName, String typeName) {
    super(
        "Field \"%s\" could not be found for type: \"%s\".".formatted(fieldName, typeName),
        Map.of("field", fieldName, "type", typeName));
    this.fieldName = fieldName;
    this.typeName = typeName;
  }

  public String getFieldName() {
    return fieldName;
  }

  public String getTypeName() {
    return typeName;
  }
}
