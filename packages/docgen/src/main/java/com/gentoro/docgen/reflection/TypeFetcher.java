package com.gentoro.docgen.reflection;

import com.gentoro.docgen.exception.FieldNotFoundException;
import com.gentoro.docgen.exception.IoException;
import com.gentoro.docgen.exception.TypeNotFoundException;
import com.gentoro.docgen.exception.ValidationException;
import java.io.IOException;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link TypeResolver} backed by a set of jar files or class directories ("assemblies").
 *
 * <p>Types are loaded through an isolated class loader whose parent is the platform class loader:
 * JDK types and the supplied assemblies are visible, the generator's own classpath is not. Common
 * .NET type names ({@code System.String}, {@code System.Int32}, ...) are accepted as aliases of
 * their Java counterparts.
 */
public class TypeFetcher implements TypeResolver, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.docgen.logging.LoggingService.getLogger(TypeFetcher.class);

  private static final Map<String, Class<?>> WELL_KNOWN_ALIASES =
      Map.ofEntries(
          Map.entry("System.String", String.class),
          Map.entry("System.Char", Character.class),
          Map.entry("System.Boolean", Boolean.class),
          Map.entry("System.Byte", Byte.class),
          Map.entry("System.Int16", Short.class),
          Map.entry("System.Int32", Integer.class),
          Map.entry("System.Int64", Long.class),
          Map.entry("System.Single", Float.class),
          Map.entry("System.Double", Double.class),
          Map.entry("System.Decimal", BigDecimal.class),
          Map.entry("System.DateTime", OffsetDateTime.class),
          Map.entry("System.DateTimeOffset", OffsetDateTime.class),
          Map.entry("System.Guid", UUID.class),
          Map.entry("System.Object", Object.class));

  private final List<Path> assemblyPaths;
  private final List<String> assemblyNames;
  private final URLClassLoader classLoader;
  private final ConcurrentMap<String, Class<?>> typeCache = new ConcurrentHashMap<>();

  public TypeFetcher(List<String> assemblyPaths) {
    this.assemblyPaths = new ArrayList<>();
    List<URL> urls = new ArrayList<>();
    for (String location : assemblyPaths) {
      Path path = Path.of(location).toAbsolutePath().normalize();
      if (!Files.exists(path)) {
        throw new IoException("Assembly not found: " + path);
      }
      this.assemblyPaths.add(path);
      try {
        urls.add(path.toUri().toURL());
      } catch (MalformedURLException e) {
        throw new IoException("Assembly path cannot be used as a class path entry: " + path, e);
      }
    }
    this.assemblyNames =
        this.assemblyPaths.stream().map(p -> p.getFileName().toString()).toList();
    this.classLoader =
        new URLClassLoader(
            "docgen-assemblies", urls.toArray(new URL[0]), ClassLoader.getPlatformClassLoader());
    log.debug("Type fetcher created over assemblies {}", this.assemblyNames);
  }

  @Override
  public List<String> assemblyNames() {
    return assemblyNames;
  }

  public List<Path> assemblyPaths() {
    return List.copyOf(assemblyPaths);
  }

  @Override
  public Class<?> resolveType(String cref) {
    CrefReference reference = CrefReference.parse(cref);
    if (reference.kind() != CrefReference.Kind.TYPE) {
      throw new ValidationException(
          "Cross-reference \"%s\" does not reference a type.".formatted(cref),
          Map.of("cref", cref));
    }
    return loadType(reference.typeName());
  }

  @Override
  public FieldDescriptor resolveField(String cref) {
    CrefReference reference = CrefReference.parse(cref);
    if (reference.kind() != CrefReference.Kind.FIELD) {
      throw new ValidationException(
          "Cross-reference \"%s\" does not reference a field.".formatted(cref),
          Map.of("cref", cref));
    }

    Class<?> type = loadType(reference.typeName());
    Field field =
        Arrays.stream(type.getFields())
            .filter(f -> Modifier.isStatic(f.getModifiers()))
            .filter(f -> f.getName().equals(reference.memberName()))
            .findFirst()
            .orElseThrow(
                () -> new FieldNotFoundException(reference.memberName(), reference.typeName()));

    try {
      field.trySetAccessible();
      Object value = field.get(null);
      log.trace("Resolved field {} to a {}", reference, field.getType().getSimpleName());
      return new FieldDescriptor(type, field.getName(), field.getType(), value);
    } catch (IllegalAccessException | ExceptionInInitializerError e) {
      throw new ValidationException(
          "Field \"%s\" of type \"%s\" could not be read."
              .formatted(reference.memberName(), reference.typeName()),
          e);
    }
  }

  /**
   * Loads a type by its qualified name. Nested types may use {@code .} instead of {@code $} and
   * array types a trailing {@code []}.
   */
  public Class<?> loadType(String typeName) {
    Class<?> cached = typeCache.get(typeName);
    if (cached != null) {
      return cached;
    }
    Class<?> loaded = doLoadType(typeName);
    typeCache.putIfAbsent(typeName, loaded);
    return loaded;
  }

  private Class<?> doLoadType(String typeName) {
    if (typeName.endsWith("[]")) {
      Class<?> component = loadType(typeName.substring(0, typeName.length() - 2));
      return Array.newInstance(component, 0).getClass();
    }

    Class<?> alias = WELL_KNOWN_ALIASES.get(typeName);
    if (alias != null) {
      return alias;
    }

    String candidate = typeName;
    while (true) {
      try {
        Class<?> type = Class.forName(candidate, false, classLoader);
        log.trace("Loaded type {} as {}", typeName, type.getName());
        return type;
      } catch (ClassNotFoundException e) {
        int lastDot = candidate.lastIndexOf('.');
        if (lastDot < 0) {
          break;
        }
        candidate = candidate.substring(0, lastDot) + '$' + candidate.substring(lastDot + 1);
      } catch (LinkageError e) {
        throw new TypeNotFoundException(typeName, assemblyNames, e);
      }
    }
    throw new TypeNotFoundException(typeName, assemblyNames);
  }

  @Override
  public void close() {
    try {
      classLoader.close();
    } catch (IOException e) {
      throw new IoException("Failed to release assemblies " + assemblyNames, e);
    }
  }
}
