package com.gentoro.docgen;

import com.gentoro.docgen.exception.DocGenException;
import com.gentoro.docgen.exception.ErrorDetails;
import com.gentoro.docgen.exception.ExceptionUtil;
import com.gentoro.docgen.exception.IoException;
import com.gentoro.docgen.logging.LoggingService;
import com.gentoro.docgen.openapi.OpenApiLoader;
import com.gentoro.docgen.processor.XmlElementProcessor;
import com.gentoro.docgen.reflection.TypeFetcher;
import com.gentoro.docgen.schema.SchemaGenerationSettings;
import com.gentoro.docgen.schema.SchemaReferenceRegistry;
import com.gentoro.docgen.xml.XmlFragments;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.examples.Example;
import io.swagger.v3.oas.models.headers.Header;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/**
 * Runs the extractor over one documentation fragment file and emits an OpenAPI document whose
 * components hold the extracted examples, headers and referenced schemas.
 */
public class DocGen {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DocGen.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;

  public DocGen(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  DocGen(StartupParameters startupParameters, ConfigurationProvider configurationProvider) {
    this.startupParameters = startupParameters;
    this.configurationProvider = configurationProvider;
  }

  public void initialize() {
    if (configurationProvider == null) {
      this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    }
    LoggingService.applyConfiguration(configurationProvider.config());
  }

  public void run(PrintStream out) {
    if (startupParameters.isHelp()) {
      out.print(StartupParameters.usage());
      return;
    }
    initialize();

    OpenAPI document = generate();
    String format =
        startupParameters
            .getOptionalParameter("format")
            .orElse(configurationProvider.outputFormat());
    String rendered = OpenApiLoader.render(document, format);

    String output = startupParameters.getOptionalParameter("output").orElse(null);
    if (output == null) {
      out.println(rendered);
      return;
    }
    try {
      Files.writeString(Path.of(output), rendered, StandardCharsets.UTF_8);
      log.info("Wrote OpenAPI document to {}", output);
    } catch (IOException e) {
      throw new IoException("Failed to write OpenAPI document to " + output, e);
    }
  }

  /** Extracts the fragment and merges the results into the base document. */
  public OpenAPI generate() {
    Element fragment = readFragment(Path.of(startupParameters.fragmentFile()));
    SchemaReferenceRegistry registry =
        new SchemaReferenceRegistry(
            SchemaGenerationSettings.forNaming(configurationProvider.propertyNaming()));

    Map<String, Example> examples;
    Map<String, Header> headers;
    try (TypeFetcher typeFetcher = new TypeFetcher(assemblies())) {
      examples = XmlElementProcessor.getOpenApiExamples(fragment, typeFetcher);
      headers = XmlElementProcessor.getOpenApiHeaders(fragment, typeFetcher, registry);
    } catch (DocGenException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error(
          "Fragment {} could not be processed: [{}] {} {}",
          startupParameters.fragmentFile(),
          details.code(),
          details.message(),
          details.context());
      throw e;
    }
    log.info(
        "Extracted {} example(s), {} header(s), {} schema(s) from {}",
        examples.size(),
        headers.size(),
        registry.references().size(),
        startupParameters.fragmentFile());

    OpenAPI document = baseDocument();
    if (document.getComponents() == null) {
      document.setComponents(new Components());
    }
    Components components = document.getComponents();
    examples.forEach(components::addExamples);
    headers.forEach(components::addHeaders);
    registry.references().forEach(components::addSchemas);
    return document;
  }

  private List<String> assemblies() {
    List<String> fromArgs = startupParameters.assemblies();
    return fromArgs.isEmpty() ? configurationProvider.assemblies() : fromArgs;
  }

  private OpenAPI baseDocument() {
    return startupParameters
        .getOptionalParameter("openapi")
        .map(OpenApiLoader::load)
        .orElseGet(
            () ->
                OpenApiLoader.create(
                    configurationProvider.documentTitle(), configurationProvider.documentVersion()));
  }

  private static Element readFragment(Path path) {
    try {
      return XmlFragments.parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new IoException("Failed to read documentation fragment " + path, e);
    }
  }
}
