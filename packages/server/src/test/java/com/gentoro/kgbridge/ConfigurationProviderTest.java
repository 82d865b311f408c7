package com.gentoro.kgbridge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgbridge.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void loadsBundledDefaults() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();
    assertEquals("neo4j", cfg.getString("graph.store.driver"));
    assertEquals("_export_id", cfg.getString("import.identity.property"));
    assertTrue(cfg.getBoolean("import.properties.coerce-objects"));
    assertTrue(cfg.getList(String.class, "gateway.query.denylist").contains("DELETE"));
    assertEquals("/mcp", cfg.getString("http.mcp.endpoint"));
  }

  @Test
  void blankLocationMeansBundledDefaults() {
    assertEquals("neo4j", new ConfigurationProvider(" ").config().getString("graph.store.driver"));
  }

  @Test
  void loadsFileAndFileUri(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("custom.yaml");
    Files.writeString(
        file,
        "graph:\n  store:\n    driver: in-memory\ngateway:\n  query:\n    default-limit: 7\n");

    assertEquals(
        "in-memory", new ConfigurationProvider(file.toString()).config().getString("graph.store.driver"));
    assertEquals(
        7, new ConfigurationProvider(file.toUri().toString()).config().getInt("gateway.query.default-limit"));
  }

  @Test
  void missingFileIsAConfigurationError(@TempDir Path dir) {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  void overridesReplaceValuesAndSkipNulls() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:application.yaml");
    Map<String, Object> overrides = new java.util.HashMap<>();
    overrides.put("graph.store.neo4j.uri", "bolt://other:7687");
    overrides.put("graph.store.neo4j.user", null);

    provider.applyOverrides(overrides);

    assertEquals("bolt://other:7687", provider.config().getString("graph.store.neo4j.uri"));
    assertEquals("neo4j", provider.config().getString("graph.store.neo4j.user"));
  }

  @Test
  void commandLineOptionsOverrideStoreSettings() {
    KgBridge kg =
        new KgBridge(new String[] {"--uri", "bolt://cli:7687", "--database", "movies"});
    kg.initialize();
    assertEquals("bolt://cli:7687", kg.configuration().getString("graph.store.neo4j.uri"));
    assertEquals("movies", kg.configuration().getString("graph.store.neo4j.database"));
    assertEquals("_export_id", kg.identityProperty());
  }
}
