package com.gentoro.docgen;

import com.gentoro.docgen.exception.ConfigException;
import com.gentoro.docgen.exception.IoException;
import com.gentoro.docgen.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration of the generator and exposes it as an Apache Commons Configuration
 * instance.
 *
 * <p>Location formats: "classpath:some/path.yaml", "file:/etc/docgen.yaml", or a plain absolute or
 * relative filesystem path. {@code ${env:NAME}} placeholders resolve against the process
 * environment first and a {@code .env.local} file second.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.docgen.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  public ConfigurationProvider(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  /** Jar files or class directories searched for cross-referenced types. */
  public List<String> assemblies() {
    return configuration.getList(String.class, "docgen.assemblies", List.of()).stream()
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public String outputFormat() {
    return configuration.getString("docgen.output.format", "json");
  }

  public String documentTitle() {
    return configuration.getString("docgen.document.title", "Generated API");
  }

  public String documentVersion() {
    return configuration.getString("docgen.document.version", "1.0.0");
  }

  public String propertyNaming() {
    return configuration.getString("docgen.schema.property-naming", "default");
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        // Missing resource falls back to an empty configuration so defaults apply.
        log.debug("Classpath resource {} not found; using defaults", resourceName);
        return addOns(new YAMLConfiguration());
      }
      log.info("Loading configuration from classpath resource: {}", resourceName);
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (IOException e) {
      throw new IoException("Failed to read classpath resource: " + resourceName, e);
    } catch (ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file);
    }
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      return loadYamlFromFile(new File(URI.create(loc)));
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback = null;

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = findEnvFile();
            this.fallback = path == null ? new HashMap<>() : readKeyValueFile(path);
          }
        }
      }
      return fallback.get(key);
    }

    private Path findEnvFile() {
      for (Path candidate : List.of(Paths.get(".env.local"), Paths.get("packages/docgen/.env.local"))) {
        if (Files.exists(candidate)) {
          return candidate;
        }
      }
      log.debug("No .env.local found; environment placeholders use the process environment only");
      return null;
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(this::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        throw new IoException("Failed to read " + path, e);
      }
    }

    private Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      String val = line.substring(idx + 1).trim();
      if ((val.startsWith("\"") && val.endsWith("\"") && val.length() > 1)
          || (val.startsWith("'") && val.endsWith("'") && val.length() > 1)) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
