package com.gentoro.docgen.schema;

/** Keeps Java property names as they are. */
public class DefaultPropertyNameResolver implements PropertyNameResolver {
  @Override
  public String resolvePropertyName(String javaName) {
    return javaName;
  }
}
