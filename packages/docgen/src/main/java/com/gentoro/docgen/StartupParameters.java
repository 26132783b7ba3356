package com.gentoro.docgen;

import com.gentoro.docgen.exception.ValidationException;
import com.gentoro.docgen.utility.StringUtility;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line arguments of the generator, given as {@code --name value} pairs. */
public class StartupParameters {

  static final Set<String> MODES = Set.of("extract", "help");
  static final Set<String> FORMATS = Set.of("json", "yaml");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "extract");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new ValidationException("Invalid mode: " + mode);
    }
    if (isHelp()) {
      return;
    }

    String configFile = parameters.get("config-file");
    if (StringUtility.isBlank(configFile)) {
      throw new ValidationException("Missing config file location");
    }
    String fragment = parameters.get("fragment");
    if (StringUtility.isBlank(fragment)) {
      throw new ValidationException("Missing --fragment <path> argument");
    }
    String format = parameters.get("format");
    if (parameters.containsKey("format") && (format == null || !FORMATS.contains(format))) {
      throw new ValidationException("Invalid format: " + format + "; expected one of " + FORMATS);
    }
  }

  public boolean isHelp() {
    return "help".equals(parameters.get("mode"));
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/docgen.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file").orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public String fragmentFile() {
    return parameters.get("fragment");
  }

  /** Assemblies given through {@code --assemblies a.jar,b.jar}; empty when not given. */
  public List<String> assemblies() {
    return getOptionalParameter("assemblies")
        .map(
            value ->
                Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList())
        .orElse(List.of());
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return """
        Usage: docgen --fragment <file.xml> [options]

          --fragment <path>       XML documentation fragment to process (required)
          --assemblies <a,b,...>  jar files or class directories to resolve cref values against
          --openapi <path>        existing OpenAPI document to add the components to
          --output <path>         file to write the document to (default: stdout)
          --format json|yaml      output format (default: docgen.output.format or json)
          --config-file <loc>     configuration location (default: classpath:application.yaml)
          --mode extract|help
        """;
  }
}
