package com.gentoro.docgen.exception;

import java.util.List;
import java.util.Map;

/** A cross-reference names a type that none of the searched assemblies contains. */
public class TypeNotFoundException extends NotFoundException {
  private final String typeName;
  private final List<String> assemblies;

  public TypeNotFoundException(String typeName, List<String> assemblies) {
    this(typeName, assemblies, null);
  }

  public TypeNotFoundException(String typeName, List<String> assemblies, Throwable cause) {
    super(
        "Type \"%s\" could not be found. Ensure that it exists in one of the following assemblies: %s"
            .formatted(typeName, String.join(", ", assemblies)),
        Map.of("type", typeName, "assemblies", List.copyOf(assemblies)),
        cause);
    this.typeName = typeName;
    this.assemblies = List.copyOf(assemblies);
  }

  public String getTypeName() {
    return typeName;
  }

  public List<String> getAssemblies() {
    return assemblies;
  }
}
