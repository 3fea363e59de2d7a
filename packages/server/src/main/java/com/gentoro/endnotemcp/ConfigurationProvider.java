package com.gentoro.endnotemcp;

import com.gentoro.endnotemcp.exception.ConfigException;
import com.gentoro.endnotemcp.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (application classpath), a {@code
 * file:} URI, or an absolute/relative filesystem path. Values may reference environment variables
 * as {@code ${env:NAME}}; variables missing from the process environment are looked up in a
 * {@code .env.local} file in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(ConfigurationProvider.class);
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader.getResource(resourceName) == null) {
      // Empty configuration; every key has a code default.
      return addOns(new YAMLConfiguration());
    }
    log.debug("Loading configuration from classpath resource: {}", resourceName);
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
      throw new ConfigException("Configuration file does not exist: " + file.getAbsolutePath());
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
    try {
      URI uri = URI.create(loc);
      if (uri.getScheme() != null && uri.getScheme().equalsIgnoreCase("file")) {
        return loadYamlFromFile(new File(uri));
      }
    } catch (IllegalArgumentException ignored) {
      // not a URI, treat as a plain path
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup(Paths.get(".env.local")));
    return config;
  }

  static class FallbackEnvLookup implements Lookup {
    private final Path envFile;
    private volatile Map<String, String> fallback;

    FallbackEnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = Files.isRegularFile(envFile) ? readKeyValueFile(envFile) : Map.of();
          }
        }
      }
      return fallback.get(key);
    }

    private static Map<String, String> readKeyValueFile(Path path) {
      log.debug("Reading environment fallback file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        Map<String, String> values =
            br.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .filter(line -> line.indexOf('=') > 0)
                .collect(
                    Collectors.toMap(
                        line -> line.substring(0, line.indexOf('=')).trim(),
                        line -> unquote(line.substring(line.indexOf('=') + 1).trim()),
                        (a, b) -> b,
                        HashMap::new));
        return Collections.unmodifiableMap(values);
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path, e.getMessage());
        return Map.of();
      }
    }

    private static String unquote(String val) {
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        return val.substring(1, val.length() - 1);
      }
      return val;
    }
  }
}
