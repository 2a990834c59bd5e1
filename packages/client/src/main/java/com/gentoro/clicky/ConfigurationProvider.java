package com.gentoro.clicky;

import com.gentoro.clicky.exception.ConfigException;
import com.gentoro.clicky.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration, either from an explicit file or from the {@code
 * application.yaml} bundled on the classpath. Values support Commons Configuration
 * interpolation, e.g. {@code ${env:CLICKY_LOG_LEVEL}}.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config = configFile == null || configFile.isBlank() ? fromClasspath() : fromFile(configFile);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration fromFile(String configFile) {
    Path path = Path.of(configFile);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    } catch (IOException e) {
      throw new ConfigException("Could not read configuration file " + path, e);
    }
  }

  private static YAMLConfiguration fromClasspath() {
    InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new ConfigException("Bundled " + DEFAULT_RESOURCE + " is missing from the classpath");
    }
    log.debug("Loading bundled {}", DEFAULT_RESOURCE);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new ConfigException("Could not read bundled " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + source, e);
    }
    return yaml;
  }
}
