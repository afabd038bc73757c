package com.gentoro.gae.config;

import com.gentoro.gae.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the application configuration from a YAML file, or from {@code application.yaml} on the
 * classpath when no file is given.
 */
public class ConfigurationProvider {
  private static final Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(Path configFile) {
    this.config = configFile == null ? loadClasspath(DEFAULT_RESOURCE) : loadFile(configFile);
  }

  public Configuration config() {
    return config;
  }

  private static Configuration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.debug("Loading configuration from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = new YAMLConfiguration();
      yaml.read(reader);
      return yaml;
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file " + file, e);
    }
  }

  private static Configuration loadClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      YAMLConfiguration yaml = new YAMLConfiguration();
      if (in == null) {
        log.warn("No {} on the classpath, using built-in defaults", resource);
        return yaml;
      }
      log.debug("Loading configuration from classpath:{}", resource);
      yaml.read(new InputStreamReader(in, StandardCharsets.UTF_8));
      return yaml;
    } catch (Exception e) {
      throw new ConfigException("Failed to read classpath configuration " + resource, e);
    }
  }
}
