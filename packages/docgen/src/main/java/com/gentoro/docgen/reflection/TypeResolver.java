package com.gentoro.docgen.reflection;

import java.util.List;

/**
 * Resolves documentation cross-references to types and constant fields.
 *
 * <p>Implementations are expected to be read-only after construction so a single instance can be
 * shared by concurrent extractions.
 */
public interface TypeResolver {

  /**
   * Resolves a type reference ({@code T:...}).
   *
   * @throws com.gentoro.docgen.exception.TypeNotFoundException if no searched assembly has it
   */
  Class<?> resolveType(String cref);

  /**
   * Resolves a field reference ({@code F:...}) and reads its value.
   *
   * @throws com.gentoro.docgen.exception.TypeNotFoundException if the declaring type is missing
   * @throws com.gentoro.docgen.exception.FieldNotFoundException if the type has no such field
   */
  FieldDescriptor resolveField(String cref);

  /** File names of the assemblies searched, in search order. */
  List<String> assemblyNames();
}
