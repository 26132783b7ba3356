package com.gentoro.docgen.schema;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.media.ArraySchema;
import io.swagger.v3.oas.models.media.BooleanSchema;
import io.swagger.v3.oas.models.media.ByteArraySchema;
import io.swagger.v3.oas.models.media.DateSchema;
import io.swagger.v3.oas.models.media.DateTimeSchema;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.MapSchema;
import io.swagger.v3.oas.models.media.NumberSchema;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.media.UUIDSchema;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Maps Java types to OpenAPI schemas. Simple types map to inline schemas; every other class is
 * registered once as a component schema and referenced through {@code $ref}.
 *
 * <p>Not thread-safe: a registry accumulates the component schemas of one document.
 */
public class SchemaReferenceRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.docgen.logging.LoggingService.getLogger(SchemaReferenceRegistry.class);

  private final SchemaGenerationSettings settings;
  private final Map<String, Schema> references = new LinkedHashMap<>();
  private final Map<Class<?>, String> keysByType = new HashMap<>();

  public SchemaReferenceRegistry(SchemaGenerationSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /** Component schemas registered so far, keyed by reference key, in registration order. */
  public Map<String, Schema> references() {
    return Collections.unmodifiableMap(references);
  }

  public Schema<?> findOrAddReference(Class<?> type) {
    return schemaFor(type);
  }

  private Schema<?> schemaFor(Type type) {
    if (type instanceof ParameterizedType parameterized) {
      Class<?> raw = (Class<?>) parameterized.getRawType();
      Type[] args = parameterized.getActualTypeArguments();
      if (Collection.class.isAssignableFrom(raw) && args.length == 1) {
        return new ArraySchema().items(schemaFor(args[0]));
      }
      if (Map.class.isAssignableFrom(raw) && args.length == 2) {
        return new MapSchema().additionalProperties(schemaFor(args[1]));
      }
      return schemaFor(raw);
    }
    if (type instanceof WildcardType wildcard) {
      Type[] upper = wildcard.getUpperBounds();
      return upper.length == 1 ? schemaFor(upper[0]) : new ObjectSchema();
    }
    if (type instanceof Class<?> clazz) {
      return schemaForClass(clazz);
    }
    // Type variables and generic arrays carry no usable shape.
    return new ObjectSchema();
  }

  private Schema<?> schemaForClass(Class<?> type) {
    Schema<?> simple = simpleSchema(type);
    if (simple != null) {
      return simple;
    }
    if (type.isArray()) {
      return new ArraySchema().items(schemaFor(type.getComponentType()));
    }
    if (Collection.class.isAssignableFrom(type)) {
      return new ArraySchema().items(new ObjectSchema());
    }
    if (Map.class.isAssignableFrom(type)) {
      return new MapSchema().additionalProperties(new ObjectSchema());
    }
    if (type.isEnum()) {
      StringSchema schema = new StringSchema();
      for (Object constant : type.getEnumConstants()) {
        schema.addEnumItem(((Enum<?>) constant).name());
      }
      return schema;
    }
    if (Object.class.equals(type)) {
      return new ObjectSchema();
    }
    return referenceTo(type);
  }

  private static Schema<?> simpleSchema(Class<?> type) {
    if (String.class.equals(type) || char.class.equals(type) || Character.class.equals(type)) {
      return new StringSchema();
    }
    if (boolean.class.equals(type) || Boolean.class.equals(type)) {
      return new BooleanSchema();
    }
    if (int.class.equals(type)
        || Integer.class.equals(type)
        || short.class.equals(type)
        || Short.class.equals(type)
        || byte.class.equals(type)
        || Byte.class.equals(type)) {
      return new IntegerSchema();
    }
    if (long.class.equals(type) || Long.class.equals(type)) {
      return new IntegerSchema().format("int64");
    }
    if (BigInteger.class.equals(type)) {
      return new IntegerSchema().format(null);
    }
    if (float.class.equals(type) || Float.class.equals(type)) {
      return new NumberSchema().format("float");
    }
    if (double.class.equals(type) || Double.class.equals(type)) {
      return new NumberSchema().format("double");
    }
    if (BigDecimal.class.equals(type)) {
      return new NumberSchema();
    }
    if (UUID.class.equals(type)) {
      return new UUIDSchema();
    }
    if (LocalDate.class.equals(type)) {
      return new DateSchema();
    }
    if (OffsetDateTime.class.equals(type)
        || ZonedDateTime.class.equals(type)
        || LocalDateTime.class.equals(type)
        || Instant.class.equals(type)
        || Date.class.isAssignableFrom(type)) {
      return new DateTimeSchema();
    }
    if (byte[].class.equals(type)) {
      return new ByteArraySchema();
    }
    return null;
  }

  private Schema<?> referenceTo(Class<?> type) {
    String key = keysByType.get(type);
    if (key == null) {
      key = referenceKey(type);
      keysByType.put(type, key);
      // Registered before its properties are built so self references terminate.
      ObjectSchema schema = new ObjectSchema();
      references.put(key, schema);
      populateProperties(type, schema);
      log.debug("Registered schema '{}' for {}", key, type.getName());
    }
    return new Schema<>().$ref(Components.COMPONENTS_SCHEMAS_REF + key);
  }

  private String referenceKey(Class<?> type) {
    String simpleName = type.getSimpleName();
    return references.containsKey(simpleName) ? type.getName() : simpleName;
  }

  private void populateProperties(Class<?> type, ObjectSchema schema) {
    PropertyNameResolver names = settings.propertyNameResolver();

    if (type.isRecord()) {
      for (RecordComponent rc : type.getRecordComponents()) {
        schema.addProperty(names.resolvePropertyName(rc.getName()), schemaFor(rc.getGenericType()));
      }
      return;
    }

    Arrays.stream(type.getFields())
        .filter(f -> !Modifier.isStatic(f.getModifiers()))
        .sorted(Comparator.comparing(Field::getName))
        .forEach(
            f ->
                schema.addProperty(
                    names.resolvePropertyName(f.getName()), schemaFor(f.getGenericType())));

    Arrays.stream(type.getMethods())
        .filter(m -> !Modifier.isStatic(m.getModifiers()))
        .filter(m -> m.getParameterCount() == 0)
        .filter(m -> m.getDeclaringClass() != Object.class)
        .sorted(Comparator.comparing(Method::getName))
        .forEach(
            m -> {
              String property = propertyName(m);
              if (property == null) return;
              String name = names.resolvePropertyName(property);
              if (schema.getProperties() == null || !schema.getProperties().containsKey(name)) {
                schema.addProperty(name, schemaFor(m.getGenericReturnType()));
              }
            });
  }

  private static String propertyName(Method method) {
    String name = method.getName();
    if (name.startsWith("get") && name.length() > 3 && method.getReturnType() != void.class) {
      return decapitalize(name.substring(3));
    }
    if (name.startsWith("is")
        && name.length() > 2
        && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
      return decapitalize(name.substring(2));
    }
    return null;
  }

  private static String decapitalize(String name) {
    if (name.length() > 1 && Character.isUpperCase(name.charAt(1))) {
      return name;
    }
    return Character.toLowerCase(name.charAt(0)) + name.substring(1);
  }
}
