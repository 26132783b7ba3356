package com.gentoro.docgen.schema;

import com.gentoro.docgen.exception.ConfigException;
import java.util.Objects;

/** Knobs applied while generating schemas for resolved types. */
public record SchemaGenerationSettings(PropertyNameResolver propertyNameResolver) {

  public SchemaGenerationSettings {
    Objects.requireNonNull(propertyNameResolver, "propertyNameResolver");
  }

  public static SchemaGenerationSettings defaults() {
    return new SchemaGenerationSettings(new DefaultPropertyNameResolver());
  }

  /** Builds settings from the {@code docgen.schema.property-naming} value. */
  public static SchemaGenerationSettings forNaming(String naming) {
    if (naming == null || naming.isBlank() || "default".equalsIgnoreCase(naming.trim())) {
      return defaults();
    }
    if ("snake-case".equalsIgnoreCase(naming.trim())) {
      return new SchemaGenerationSettings(new SnakeCasePropertyNameResolver());
    }
    throw new ConfigException("Unsupported property naming strategy: " + naming);
  }
}
