package com.gentoro.reformat;

import com.gentoro.reformat.exception.ConfigurationException;
import com.gentoro.reformat.logging.LoggingService;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the application configuration from YAML.
 *
 * <p>The location may be a plain filesystem path or a {@code file:} URI. When no location is
 * given, {@code application.yaml} is loaded from the classpath.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String location) {
    this.config = new YAMLConfiguration();
    if (location == null || location.isBlank()) {
      loadClasspath();
    } else {
      loadFile(toPath(location));
    }
  }

  public Configuration config() {
    return config;
  }

  private void loadClasspath() {
    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.warn("No {} found on the classpath, using built-in defaults", DEFAULT_RESOURCE);
        return;
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        config.read(reader);
      }
      log.debug("Loaded configuration from classpath resource {}", DEFAULT_RESOURCE);
    } catch (Exception e) {
      throw new ConfigurationException("Failed to read classpath " + DEFAULT_RESOURCE, e);
    }
  }

  private void loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigurationException("Configuration file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      config.read(reader);
      log.debug("Loaded configuration from {}", path);
    } catch (Exception e) {
      throw new ConfigurationException("Failed to read configuration file " + path, e);
    }
  }

  private static Path toPath(String location) {
    if (location.startsWith("file:")) {
      return Path.of(URI.create(location));
    }
    return Path.of(location);
  }
}
