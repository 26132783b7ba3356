package com.gentoro.docgen.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gentoro.docgen.exception.SerializationException;

public class JacksonUtility {
  // YAML is a superset of JSON, so this mapper reads both fragment styles.
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /**
   * Parses a serialized JSON or YAML fragment into a tree. An empty fragment yields a missing
   * node.
   */
  public static JsonNode readFragment(String fragment) {
    if (fragment == null || fragment.isBlank()) {
      return JSON_MAPPER.missingNode();
    }
    try {
      return YAML_MAPPER.readTree(fragment);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to parse fragment as JSON or YAML", e);
    }
  }
}
