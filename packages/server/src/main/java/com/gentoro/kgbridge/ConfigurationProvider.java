package com.gentoro.kgbridge;

import com.gentoro.kgbridge.exception.ConfigException;
import com.gentoro.kgbridge.exception.SerializationException;
import com.gentoro.kgbridge.logging.LoggingService;
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
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration and exposes it as an Apache Commons {@link Configuration}.
 *
 * <p>Location formats: {@code classpath:some/path.yaml}, a {@code file:} URI, or a plain
 * filesystem path. {@code ${env:NAME}} lookups read the process environment first and then a
 * {@code .env.local} file (current directory, then {@code packages/server/}, or the file named by
 * {@code KGBRIDGE_ENV_FILE}).
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  /**
   * Replace keys with values supplied on the command line. Null values are skipped so an absent
   * option never blanks a configured one.
   */
  public void applyOverrides(Map<String, ?> overrides) {
    overrides.forEach(
        (key, value) -> {
          if (value != null) {
            log.debug("Overriding configuration key '{}' from command line", key);
            configuration.setProperty(key, value);
          }
        });
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl.getResource(resourceName) == null) {
      log.warn("Configuration resource '{}' not found; using built-in defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = cl.getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(new String(input.readAllBytes(), StandardCharsets.UTF_8)));
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
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback;

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
            if (path == null) {
              log.debug("No .env.local found; '{}' resolves from the environment only", key);
              this.fallback = new HashMap<>();
            } else {
              this.fallback = readKeyValueFile(path);
            }
          }
        }
      }
      return fallback.get(key);
    }

    private Path findEnvFile() {
      String explicit = System.getenv("KGBRIDGE_ENV_FILE");
      if (explicit != null && !explicit.isBlank()) {
        Path p = Paths.get(explicit);
        if (Files.exists(p)) return p;
        log.warn("KGBRIDGE_ENV_FILE points to a missing file: {}", p.toAbsolutePath());
      }
      for (Path candidate : List.of(Paths.get(".env.local"), Paths.get("packages/server/.env.local"))) {
        if (Files.exists(candidate)) return candidate;
      }
      return null;
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .map(FallbackEnvLookup::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path, e.getMessage());
        return Collections.emptyMap();
      }
    }

    private static Map.Entry<String, String> parseLine(String line) {
      String body = line.startsWith("export ") ? line.substring(7).trim() : line;
      int idx = body.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = body.substring(0, idx).trim();
      String val = body.substring(idx + 1).trim();
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
