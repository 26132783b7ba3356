package com.gentoro.docgen.openapi;

import com.gentoro.docgen.exception.SerializationException;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.SwaggerParseResult;

/** Reads and writes OpenAPI documents. */
public class OpenApiLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.docgen.logging.LoggingService.getLogger(OpenApiLoader.class);

  public static OpenAPI load(String specPath) {
    SwaggerParseResult result = new OpenAPIV3Parser().readLocation(specPath, null, null);
    if (result.getOpenAPI() == null) {
      throw new SerializationException(
          "Failed to read OpenAPI document %s: %s".formatted(specPath, result.getMessages()));
    }
    if (result.getMessages() != null && !result.getMessages().isEmpty()) {
      log.warn("OpenAPI document {} parsed with messages: {}", specPath, result.getMessages());
    }
    return result.getOpenAPI();
  }

  public static OpenAPI create(String title, String version) {
    return new OpenAPI().info(new Info().title(title).version(version));
  }

  /** Serializes {@code openAPI} as {@code json} or {@code yaml}. */
  public static String render(OpenAPI openAPI, String format) {
    try {
      return switch (format) {
        case "json" -> Json.pretty().writeValueAsString(openAPI);
        case "yaml" -> Yaml.pretty().writeValueAsString(openAPI);
        default -> throw new SerializationException("Unsupported output format: " + format);
      };
    } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
      throw new SerializationException("Failed to serialize OpenAPI document", e);
    }
  }
}
