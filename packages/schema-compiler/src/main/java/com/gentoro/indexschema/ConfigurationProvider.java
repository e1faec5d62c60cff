package com.gentoro.indexschema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.indexschema.exception.ConfigException;
import com.gentoro.indexschema.exception.SerializationException;
import com.gentoro.indexschema.utility.JacksonUtility;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), "file:" URIs, and absolute or relative filesystem paths. A missing classpath resource
 * yields an empty configuration so that defaults apply.
 *
 * <p>Scalar keys are read through {@link #config()}. Nested structures whose list shape matters,
 * such as the analysis settings, are read through {@link #section(String)}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.indexschema.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:indexschema.yaml";

  private final Configuration configuration;
  private final Map<String, Object> tree;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    String yaml = readYaml(loc);
    this.configuration = yaml == null ? new YAMLConfiguration() : loadYaml(loc, yaml);
    this.tree = yaml == null ? new LinkedHashMap<>() : readTree(loc, yaml);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  /**
   * Returns the nested map under the top-level key {@code name}, with {@code ${...}} expressions in
   * string values interpolated like the ones read through {@link #config()}. Missing keys yield an
   * empty map.
   */
  public Map<String, Object> section(String name) {
    Object value = tree.get(name);
    if (!(value instanceof Map<?, ?> map)) {
      return new LinkedHashMap<>();
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) interpolate(map);
    return result;
  }

  private Object interpolate(Object value) {
    ConfigurationInterpolator interpolator = configuration.getInterpolator();
    if (value instanceof String s) {
      Object resolved = interpolator == null ? s : interpolator.interpolate(s);
      return resolved == null ? s : resolved;
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(String.valueOf(k), interpolate(v)));
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>();
      list.forEach(v -> copy.add(interpolate(v)));
      return copy;
    }
    return value;
  }

  private static String readYaml(String location) {
    if (location.startsWith("classpath:")) {
      return readClasspath(location.substring("classpath:".length()));
    }
    File file = toFile(location);
    try {
      return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigException("Failed to read YAML file: " + file, e);
    }
  }

  private static String readClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      log.warn("Configuration resource {} not found on classpath, using defaults", resourceName);
      return null;
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYaml(String location, String yaml) {
    if (location.startsWith("classpath:")) {
      try {
        YAMLConfiguration config = new YAMLConfiguration();
        config.read(new StringReader(yaml));
        return config;
      } catch (ConfigurationException e) {
        throw new SerializationException("Failed to parse YAML from " + location, e);
      }
    }
    File file = toFile(location);
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Map<String, Object> readTree(String location, String yaml) {
    if (yaml.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, Object> result =
          JacksonUtility.getYamlMapper()
              .readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {});
      return result == null ? new LinkedHashMap<>() : result;
    } catch (IOException e) {
      throw new SerializationException("Failed to parse YAML from " + location, e);
    }
  }

  private static File toFile(String location) {
    try {
      URI uri = URI.create(location);
      if (uri.getScheme() != null && uri.getScheme().equalsIgnoreCase("file")) {
        return new File(uri);
      }
    } catch (IllegalArgumentException e) {
      log.trace("{} is not a URI, treating it as a file path", location);
    }
    return new File(location);
  }
}
