package com.gentoro.docgen.schema;

/** {@code orderId} becomes {@code order_id}; {@code URLValue} becomes {@code url_value}. */
public class SnakeCasePropertyNameResolver implements PropertyNameResolver {
  @Override
  public String resolvePropertyName(String javaName) {
    return javaName
        .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
        .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
        .toLowerCase();
  }
}
