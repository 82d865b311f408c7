package com.gentoro.kgbridge.gateway;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.kgbridge.KgBridgeFixture;
import com.gentoro.kgbridge.exception.UnsupportedFeatureException;
import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.memory.InMemoryGraphStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GraphGatewayToolsTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private InMemoryGraphStore store;
  private GraphGatewayTools tools;

  @BeforeEach
  void setUp() {
    store = new InMemoryGraphStore();
    store.initialize();
    try (GraphSession s = store.openSession()) {
      for (int i = 0; i < 4; i++) {
        s.createNode(List.of("Person"), Map.of("name", "p" + i, "age", (long) (20 + i)));
      }
      s.createNode(List.of("Company"), Map.of("name", "Acme"));
      s.createRelationship("name", "p0", "Acme", "WORKS_AT", Map.of());
    }
    tools =
        new GraphGatewayTools(
            () -> store,
            new SchemaIntrospector(),
            new QuerySafetyGateway(new ReadOnlyQueryGuard(), 25),
            3);
  }

  @Test
  void reportsStats() throws Exception {
    JsonNode stats = mapper.readTree(tools.graphStats());
    assertEquals(5, stats.get("nodeCount").asInt());
    assertEquals(1, stats.get("edgeCount").asInt());
  }

  @Test
  void reportsSchemaWithPerLabelKeys() throws Exception {
    JsonNode schema = mapper.readTree(tools.graphSchema());
    assertEquals("Company", schema.get("labels").get(0).asText());
    assertEquals("WORKS_AT", schema.get("relationshipTypes").get(0).asText());
    assertEquals(2, schema.get("labelProperties").get("Person").size());
    assertTrue(schema.get("namePropertyRule").asText().length() > 0);
  }

  @Test
  void samplesAreClampedAndUnknownLabelsExplained() throws Exception {
    assertEquals(3, mapper.readTree(tools.sampleNodes("Person", 50)).size());
    assertEquals(1, mapper.readTree(tools.sampleNodes("Person", 0)).size());
    assertEquals(4, mapper.readTree(tools.sampleNodes("Person", null)).size());
    assertEquals("Unknown label: Robot", tools.sampleNodes("Robot", 2));
    assertThrows(ValidationException.class, () -> tools.sampleNodes(" ", 2));
  }

  @Test
  void queryRunnerRefusesWritesBeforeTouchingTheStore() {
    assertEquals(QuerySafetyGateway.REFUSAL, tools.runQuery("CREATE (n:Hack)"));
    assertThrows(ValidationException.class, () -> tools.runQuery(""));
    assertThrows(UnsupportedFeatureException.class, () -> tools.runQuery("MATCH (n) RETURN n"));
  }

  @Test
  void configuredDenylistReplacesTheDefault() {
    KgBridgeFixture kg =
        new KgBridgeFixture(Map.of("gateway.query.denylist", List.of("DETACH")));
    GraphGatewayTools configured = new GraphGatewayTools(kg);
    assertEquals(QuerySafetyGateway.REFUSAL, configured.runQuery("MATCH (n) DETACH DELETE n"));
    assertThrows(UnsupportedFeatureException.class, () -> configured.runQuery("MERGE (n:A) RETURN n"));
  }
}
