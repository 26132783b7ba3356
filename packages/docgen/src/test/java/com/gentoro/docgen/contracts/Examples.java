package com.gentoro.docgen.contracts;

/** Constants referenced by {@code <see cref="F:..."/>} in example fragments. */
public class Examples {

  public static final String SAMPLE_OBJECT1_EXAMPLE =
      """
      {
        "samplePropertyString1": "Test",
        "samplePropertyInt": 1,
        "samplePropertyBool": true,
        "tags": ["a", "b"]
      }
      """;

  public static final String SAMPLE_YAML_EXAMPLE =
      """
      name: yaml sample
      count: 2
      """;

  public static final int ANSWER = 42;

  public static final String MISSING_VALUE = null;

  public final String instanceExample = "{}";

  public static class Nested {
    public static final String NESTED_EXAMPLE = "\"nested\"";
  }
}
