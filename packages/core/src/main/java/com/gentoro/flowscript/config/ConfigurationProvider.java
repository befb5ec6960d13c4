package com.gentoro.flowscript.config;

import com.gentoro.flowscript.exception.ConfigException;
import com.gentoro.flowscript.exception.SerializationException;
import com.gentoro.flowscript.logging.LoggingService;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.slf4j.Logger;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), "file:/etc/flowscript.yaml", or a plain absolute or relative filesystem path. A null
 * or blank location means "classpath:application.yaml". Values may reference environment
 * variables with {@code ${env:NAME}}; system properties of the same name are the fallback.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);
  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider() {
    this(null);
  }

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    URL resourceUrl = loader.getResource(resourceName);
    if (resourceUrl == null) {
      log.debug("No classpath resource {}, using built-in defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
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
      return loadYamlFromClasspath(DEFAULT_RESOURCE);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new EnvLookup());
    return config;
  }

  private static class EnvLookup implements Lookup {
    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      return System.getProperty(key);
    }
  }
}
