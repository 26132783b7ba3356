package com.gentoro.docgen.processor;

import static com.gentoro.docgen.xml.XmlFragments.attribute;
import static com.gentoro.docgen.xml.XmlFragments.children;
import static com.gentoro.docgen.xml.XmlFragments.descendants;
import static com.gentoro.docgen.xml.XmlFragments.firstChild;
import static com.gentoro.docgen.xml.XmlFragments.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docgen.exception.InvalidExampleException;
import com.gentoro.docgen.exception.InvalidHeaderException;
import com.gentoro.docgen.reflection.CrefReference;
import com.gentoro.docgen.reflection.FieldDescriptor;
import com.gentoro.docgen.reflection.TypeResolver;
import com.gentoro.docgen.schema.SchemaReferenceRegistry;
import com.gentoro.docgen.utility.JacksonUtility;
import com.gentoro.docgen.utility.StringUtility;
import com.gentoro.docgen.xml.KnownXmlStrings;
import io.swagger.v3.oas.models.examples.Example;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.media.Schema;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Builds OpenAPI examples and headers out of the {@code <example>} and {@code <header>} tags of a
 * documentation fragment.
 *
 * <p>Both operations are all-or-nothing: the first malformed tag or unresolvable reference is
 * thrown and no partial result is returned.
 */
public final class XmlElementProcessor {
  private static final org.slf4j.Logger log =
      com.gentoro.docgen.logging.LoggingService.getLogger(XmlElementProcessor.class);

  static final String GENERATED_EXAMPLE_KEY_PREFIX = "example";

  public static final String PROVIDE_EITHER_VALUE_OR_URL_TAG =
      "Provide either value or url tag for example, not both.";
  public static final String PROVIDE_VALUE_OR_URL_FOR_EXAMPLE =
      "Example must provide either a value or url tag.";
  public static final String PROVIDE_VALUE_FOR_EXAMPLE = "Example must provide a value.";
  public static final String MISSING_NAME_ATTRIBUTE =
      "The \"name\" attribute is missing on the <%s> tag.";
  public static final String MISSING_CREF_ATTRIBUTE =
      "Header \"%s\" must reference its type through a cref attribute.";
  public static final String DUPLICATE_KEY = "Duplicate %s name \"%s\" in documentation fragment.";

  private XmlElementProcessor() {}

  /**
   * Extracts every {@code <example>} below {@code fragment}, in document order. Examples without a
   * {@code name} attribute are keyed {@code example1}, {@code example2}, ...; an {@code <example>}
   * without child elements is skipped and consumes no key.
   */
  public static Map<String, Example> getOpenApiExamples(
      Element fragment, TypeResolver typeResolver) {
    Objects.requireNonNull(fragment, "fragment");
    Objects.requireNonNull(typeResolver, "typeResolver");

    Map<String, Example> examples = new LinkedHashMap<>();
    int counter = 1;
    for (Element exampleElement : descendants(fragment, KnownXmlStrings.EXAMPLE)) {
      Optional<Example> example = toOpenApiExample(exampleElement, typeResolver);
      if (example.isEmpty()) {
        log.warn("Skipping <example> tag without content");
        continue;
      }

      String name = StringUtility.trimToNull(attribute(exampleElement, KnownXmlStrings.NAME));
      String key = name != null ? name : GENERATED_EXAMPLE_KEY_PREFIX + counter++;
      if (examples.containsKey(key)) {
        throw new InvalidExampleException(
            DUPLICATE_KEY.formatted(KnownXmlStrings.EXAMPLE, key), Map.of("name", key));
      }
      examples.put(key, example.get());
      log.debug("Extracted example '{}'", key);
    }
    return examples;
  }

  private static Optional<Example> toOpenApiExample(Element element, TypeResolver typeResolver) {
    if (children(element).isEmpty()) {
      return Optional.empty();
    }

    Optional<Element> valueElement = firstChild(element, KnownXmlStrings.VALUE);
    Optional<Element> urlElement = firstChild(element, KnownXmlStrings.URL);

    if (valueElement.isPresent() && urlElement.isPresent()) {
      throw new InvalidExampleException(PROVIDE_EITHER_VALUE_OR_URL_TAG);
    }
    if (valueElement.isEmpty() && urlElement.isEmpty()) {
      throw new InvalidExampleException(PROVIDE_VALUE_OR_URL_FOR_EXAMPLE);
    }

    Example example = new Example();
    firstChild(element, KnownXmlStrings.SUMMARY)
        .map(summary -> StringUtility.normalizeText(text(summary)))
        .ifPresent(example::setSummary);

    if (urlElement.isPresent()) {
      String url = StringUtility.trimToNull(text(urlElement.get()));
      if (url == null) {
        throw new InvalidExampleException(PROVIDE_VALUE_OR_URL_FOR_EXAMPLE);
      }
      example.setExternalValue(url);
      return Optional.of(example);
    }

    Element value = valueElement.get();
    String cref = firstCref(element);
    if (cref != null) {
      example.setValue(resolveExampleValue(cref, typeResolver));
    } else {
      String inline = StringUtility.trimToNull(text(value));
      if (inline == null) {
        throw new InvalidExampleException(PROVIDE_VALUE_FOR_EXAMPLE);
      }
      example.setValue(inline);
    }
    return Optional.of(example);
  }

  private static JsonNode resolveExampleValue(String cref, TypeResolver typeResolver) {
    if (CrefReference.parse(cref).kind() != CrefReference.Kind.FIELD) {
      throw new InvalidExampleException(
          "Example value must reference a field, got \"%s\".".formatted(cref),
          Map.of("cref", cref));
    }
    FieldDescriptor field = typeResolver.resolveField(cref);
    if (field.value() == null) {
      throw new InvalidExampleException(
          "Field \"%s\" referenced by an example has no value.".formatted(field.name()),
          Map.of("cref", cref));
    }
    log.trace("Parsing example value of {}", cref);
    return JacksonUtility.readFragment(field.value().toString());
  }

  /**
   * Extracts the direct {@code <header>} children of {@code fragment}. Each header needs a {@code
   * name} attribute and a type reference, either as its own {@code cref} attribute or through a
   * nested {@code <see cref="..."/>}.
   */
  public static Map<String, Header> getOpenApiHeaders(
      Element fragment, TypeResolver typeResolver, SchemaReferenceRegistry schemaReferenceRegistry) {
    Objects.requireNonNull(fragment, "fragment");
    Objects.requireNonNull(typeResolver, "typeResolver");
    Objects.requireNonNull(schemaReferenceRegistry, "schemaReferenceRegistry");

    Map<String, Header> headers = new LinkedHashMap<>();
    for (Element headerElement : children(fragment, KnownXmlStrings.HEADER)) {
      String name = StringUtility.trimToNull(attribute(headerElement, KnownXmlStrings.NAME));
      if (name == null) {
        throw new InvalidHeaderException(
            MISSING_NAME_ATTRIBUTE.formatted(KnownXmlStrings.HEADER),
            Map.of("tag", KnownXmlStrings.HEADER));
      }
      if (headers.containsKey(name)) {
        throw new InvalidHeaderException(
            DUPLICATE_KEY.formatted(KnownXmlStrings.HEADER, name), Map.of("name", name));
      }

      String cref = StringUtility.trimToNull(attribute(headerElement, KnownXmlStrings.CREF));
      if (cref == null) {
        cref = firstCref(headerElement);
      }
      if (cref == null) {
        throw new InvalidHeaderException(
            MISSING_CREF_ATTRIBUTE.formatted(name), Map.of("name", name));
      }

      Class<?> type = typeResolver.resolveType(cref);
      Schema<?> schema = schemaReferenceRegistry.findOrAddReference(type);

      Header header = new Header();
      header.setSchema(schema);
      firstChild(headerElement, KnownXmlStrings.DESCRIPTION)
          .map(description -> StringUtility.normalizeText(text(description)))
          .ifPresent(header::setDescription);

      headers.put(name, header);
      log.debug("Extracted header '{}' of type {}", name, type.getName());
    }
    return headers;
  }

  private static String firstCref(Element element) {
    return descendants(element, KnownXmlStrings.SEE).stream()
        .map(see -> StringUtility.trimToNull(attribute(see, KnownXmlStrings.CREF)))
        .filter(Objects::nonNull)
        .findFirst()
        .orElse(null);
  }
}
