package com.gentoro.docgen.reflection;

/**
 * A resolved public static field together with the value it held at resolution time.
 *
 * @param declaringType type the field was looked up on
 * @param name field name
 * @param type declared type of the field
 * @param value current value, possibly {@code null}
 */
public record FieldDescriptor(Class<?> declaringType, String name, Class<?> type, Object value) {}
