package com.gentoro.docgen;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docgen.contracts.ContractAssemblies;
import com.gentoro.docgen.exception.InvalidExampleException;
import com.gentoro.docgen.exception.TypeNotFoundException;
import com.gentoro.docgen.utility.JacksonUtility;
import io.swagger.v3.oas.models.OpenAPI;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocGen end to end")
class DocGenTest {

  @TempDir Path tempDir;

  private Path jar;
  private Path fragment;

  @BeforeEach
  void setUp() throws Exception {
    jar = ContractAssemblies.buildJar(tempDir);
    fragment = tempDir.resolve("orders.xml");
    try (InputStream in = getClass().getResourceAsStream("/fragments/orders.xml")) {
      assertNotNull(in, "fragments/orders.xml test resource");
      Files.write(fragment, in.readAllBytes());
    }
  }

  private static String run(String... args) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    new DocGen(args).run(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void writesExamplesHeadersAndSchemasAsJson() throws Exception {
    String output = run("--fragment", fragment.toString(), "--assemblies", jar.toString());

    JsonNode document = JacksonUtility.getJsonMapper().readTree(output);
    assertEquals("Generated API", document.at("/info/title").asText());

    JsonNode examples = document.at("/components/examples");
    assertEquals(List.of("Order", "example1", "example2"), fieldNames(examples));
    assertEquals("A full order", examples.at("/Order/summary").asText());
    assertEquals("Test", examples.at("/Order/value/samplePropertyString1").asText());
    assertEquals(1, examples.at("/Order/value/samplePropertyInt").asInt());
    assertEquals(
        "https://localhost/orders/1.json", examples.at("/example1/externalValue").asText());
    assertEquals("plain text", examples.at("/example2/value").asText());

    JsonNode headers = document.at("/components/headers");
    assertEquals(List.of("X-Request-Id", "X-Sample"), fieldNames(headers));
    assertEquals("uuid", headers.at("/X-Request-Id/schema/format").asText());
    assertEquals(
        "Correlates the request with server logs.",
        headers.at("/X-Request-Id/description").asText());
    assertEquals(
        "#/components/schemas/SampleObject1", headers.at("/X-Sample/schema/$ref").asText());

    assertTrue(document.at("/components/schemas/SampleObject1/properties/tags").isObject());
    assertTrue(document.at("/components/schemas/SampleObject1/properties/archived").isObject());
  }

  @Test
  void mergesIntoAnExistingDocument() throws Exception {
    Path base = Paths.get(getClass().getResource("/openapi/base.yaml").toURI());

    OpenAPI document =
        new DocGen(
                new StartupParameters(
                    new String[] {
                      "--fragment", fragment.toString(),
                      "--assemblies", jar.toString(),
                      "--openapi", base.toString()
                    }),
                new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION))
            .generate();

    assertEquals("Orders Service", document.getInfo().getTitle());
    assertNotNull(document.getPaths().get("/orders"));
    assertTrue(document.getComponents().getSchemas().containsKey("Existing"));
    assertTrue(document.getComponents().getSchemas().containsKey("SampleObject1"));
    assertEquals(3, document.getComponents().getExamples().size());
    assertEquals(2, document.getComponents().getHeaders().size());
  }

  @Test
  void writesYamlToOutputFile() throws Exception {
    Path out = tempDir.resolve("openapi.yaml");

    String stdout =
        run(
            "--fragment", fragment.toString(),
            "--assemblies", jar.toString(),
            "--format", "yaml",
            "--output", out.toString());

    assertEquals("", stdout);
    JsonNode document = JacksonUtility.getYamlMapper().readTree(Files.readString(out));
    assertEquals("A full order", document.at("/components/examples/Order/summary").asText());
  }

  @Test
  void configurationDrivesTitleAndPropertyNaming() {
    ConfigurationProvider configuration = new ConfigurationProvider("classpath:docgen-test.yaml");
    OpenAPI document =
        new DocGen(
                new StartupParameters(
                    new String[] {
                      "--fragment", fragment.toString(), "--assemblies", jar.toString()
                    }),
                configuration)
            .generate();

    assertEquals("Orders API", document.getInfo().getTitle());
    assertEquals("2.0.0", document.getInfo().getVersion());
    assertTrue(
        document
            .getComponents()
            .getSchemas()
            .get("SampleObject1")
            .getProperties()
            .containsKey("sample_property_string1"));
  }

  @Test
  void unresolvableReferenceFailsTheWholeRun() throws Exception {
    Path broken = tempDir.resolve("broken.xml");
    Files.writeString(
        broken,
        "<member><example><value><see cref=\"F:acme.Missing.VALUE\"/></value></example></member>");

    TypeNotFoundException ex =
        assertThrows(
            TypeNotFoundException.class,
            () -> run("--fragment", broken.toString(), "--assemblies", jar.toString()));
    assertEquals(List.of(ContractAssemblies.JAR_NAME), ex.getAssemblies());
  }

  @Test
  void malformedExampleFailsTheWholeRun() throws Exception {
    Path broken = tempDir.resolve("both.xml");
    Files.writeString(
        broken, "<member><example><value>a</value><url>b</url></example></member>");

    assertThrows(InvalidExampleException.class, () -> run("--fragment", broken.toString()));
  }

  @Test
  void helpPrintsUsage() {
    String output = run("--mode", "help");
    assertTrue(output.startsWith("Usage: docgen"));
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }
}
