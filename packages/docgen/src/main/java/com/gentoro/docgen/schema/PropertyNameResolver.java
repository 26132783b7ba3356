package com.gentoro.docgen.schema;

/** Maps a Java property name to the name it carries in a generated schema. */
@FunctionalInterface
public interface PropertyNameResolver {
  String resolvePropertyName(String javaName);
}
