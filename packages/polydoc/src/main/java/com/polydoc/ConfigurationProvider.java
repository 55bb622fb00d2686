package com.polydoc;

import com.polydoc.exception.ConfigException;
import com.polydoc.exception.SerializationException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Reads the polydoc YAML settings into an Apache Commons {@link Configuration}.
 *
 * <p>A location is either {@code classpath:<resource>}, a {@code file:} URI or a filesystem
 * path; blank means {@link #DEFAULT_LOCATION}. Values may reference environment variables as
 * {@code ${env:NAME}}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String CLASSPATH_PREFIX = "classpath:";
  public static final String DEFAULT_LOCATION = CLASSPATH_PREFIX + "application.yaml";

  private final String location;
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.location = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    this.configuration = withEnvironment(load(this.location), System.getenv());
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  public String location() {
    return location;
  }

  private static YAMLConfiguration load(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    return fromFile(toFile(location));
  }

  private static File toFile(String location) {
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return Path.of(URI.create(location)).toFile();
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + location, e);
      }
    }
    return new File(location);
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    InputStream input = loader.getResourceAsStream(resource);
    if (input == null) {
      // every key then falls back to its PolydocSettings default
      log.warn("Configuration resource {} not found on classpath, using defaults", resource);
      return new YAMLConfiguration();
    }
    log.debug("Loading configuration from classpath resource {}", resource);
    try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = new YAMLConfiguration();
      yaml.read(reader);
      return yaml;
    } catch (ConfigurationException | IOException e) {
      throw new SerializationException("Malformed YAML in classpath resource " + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.debug("Loading configuration from {}", file.getAbsolutePath());
    FileBasedConfigurationBuilder<YAMLConfiguration> builder =
        new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
            .configure(new Parameters().fileBased().setFile(file));
    try {
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Malformed YAML in " + file.getAbsolutePath(), e);
    }
  }

  /** Registers the {@code env} prefix so {@code ${env:NAME}} reads from {@code environment}. */
  static Configuration withEnvironment(Configuration config, Map<String, String> environment) {
    config
        .getInterpolator()
        .registerLookup(
            "env",
            name -> {
              String value = environment.get(name);
              return value == null || value.isEmpty() ? null : value;
            });
    return config;
  }
}
