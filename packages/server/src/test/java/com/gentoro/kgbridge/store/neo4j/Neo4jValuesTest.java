package com.gentoro.kgbridge.store.neo4j;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.types.Node;

class Neo4jValuesTest {

  @Test
  void flattensEntitiesToPropertyMaps() {
    Node node = mock(Node.class);
    when(node.asMap()).thenReturn(Map.of("name", "Alice"));

    Object plain = Neo4jValues.plain(Map.of("n", node, "names", List.of(node)));

    assertEquals(Map.of("n", Map.of("name", "Alice"), "names", List.of(Map.of("name", "Alice"))), plain);
  }

  @Test
  void rendersTemporalValuesAsText() {
    assertEquals("2024-01-02", Neo4jValues.plain(LocalDate.of(2024, 1, 2)));
    assertEquals(5L, Neo4jValues.plain(5L));
    assertNull(Neo4jValues.plain(null));
  }
}
