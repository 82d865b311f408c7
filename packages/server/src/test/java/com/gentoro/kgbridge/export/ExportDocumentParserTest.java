package com.gentoro.kgbridge.export;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgbridge.exception.IoException;
import com.gentoro.kgbridge.exception.KgBridgeErrorCode;
import com.gentoro.kgbridge.exception.MalformedExportException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportDocumentParserTest {

  private final ExportDocumentParser parser = new ExportDocumentParser();

  @Test
  @DisplayName("Nodes and relationships keep order, ids, labels and typed properties")
  void parsesPropertyGraph() {
    ExportDocument doc =
        parser.parse(
            "{\"nodes\":["
                + "{\"id\":1,\"labels\":[\"Person\"],\"properties\":{\"label\":\"Alice\",\"age\":30,"
                + "\"score\":1.5,\"active\":true,\"tags\":[\"a\",\"b\"],\"meta\":{\"x\":1},\"gone\":null}},"
                + "{\"id\":\"p2\",\"labels\":[\"Person\",\"Author\"]}],"
                + "\"relationships\":[{\"type\":\"KNOWS\",\"startNodeId\":1,\"endNodeId\":\"p2\","
                + "\"properties\":{\"since\":2020}}]}");

    PropertyGraphExport graph = doc.propertyGraph().orElseThrow();
    assertEquals(2, graph.nodes().size());
    ExportedNode alice = graph.nodes().get(0);
    assertEquals(PropertyValue.ofInteger(1), alice.getId());
    assertEquals(List.of("Person"), alice.getLabels());
    assertEquals(PropertyValue.Kind.STRING, alice.getProperties().get("label").kind());
    assertEquals(PropertyValue.Kind.INTEGER, alice.getProperties().get("age").kind());
    assertEquals(PropertyValue.Kind.FLOAT, alice.getProperties().get("score").kind());
    assertEquals(PropertyValue.Kind.BOOLEAN, alice.getProperties().get("active").kind());
    assertEquals(List.of("a", "b"), alice.getProperties().get("tags").raw());
    assertEquals("{\"x\":1}", alice.getProperties().get("meta").raw());
    assertTrue(alice.getProperties().get("gone").isNull());
    assertEquals("Alice", alice.displayName());

    assertEquals(List.of("Person", "Author"), graph.nodes().get(1).getLabels());
    assertEquals(PropertyValue.ofString("p2"), graph.nodes().get(1).getId());

    ExportedRelationship rel = graph.relationships().get(0);
    assertEquals("KNOWS", rel.getType());
    assertEquals(PropertyValue.ofInteger(1), rel.getStartNodeId());
    assertEquals(PropertyValue.ofString("p2"), rel.getEndNodeId());
    assertEquals(2020L, rel.getProperties().get("since").raw());
    assertTrue(doc.cypherScript().isEmpty());
    assertTrue(doc.tensor().isEmpty());
  }

  @Test
  @DisplayName("Missing labels and relationship type fall back to defaults")
  void appliesDefaults() {
    PropertyGraphExport graph =
        parser
            .parse(
                "{\"nodes\":[{\"id\":1},{\"id\":2,\"labels\":[]}],"
                    + "\"relationships\":[{\"startNodeId\":1,\"endNodeId\":2},"
                    + "{\"type\":\" \",\"startNodeId\":2,\"endNodeId\":1}]}")
            .propertyGraph()
            .orElseThrow();

    assertEquals(List.of(ExportedNode.DEFAULT_LABEL), graph.nodes().get(0).getLabels());
    assertEquals(List.of("Node"), graph.nodes().get(1).getLabels());
    assertEquals("RELATED_TO", graph.relationships().get(0).getType());
    assertEquals("RELATED_TO", graph.relationships().get(1).getType());
  }

  @Test
  void nodeWithoutIdIsMalformed() {
    MalformedExportException ex =
        assertThrows(
            MalformedExportException.class,
            () -> parser.parse("{\"nodes\":[{\"id\":1},{\"labels\":[\"X\"]}]}"));
    assertEquals(1, ex.getContext().get("index"));
    assertEquals(KgBridgeErrorCode.MALFORMED_EXPORT, ex.getCode());
  }

  @Test
  void relationshipWithoutEndpointIsMalformed() {
    assertThrows(
        MalformedExportException.class,
        () -> parser.parse("{\"nodes\":[],\"relationships\":[{\"startNodeId\":1}]}"));
    assertThrows(
        MalformedExportException.class,
        () ->
            parser.parse(
                "{\"relationships\":[{\"startNodeId\":null,\"endNodeId\":2}]}"));
  }

  @Test
  void rejectsInvalidDocuments() {
    assertThrows(MalformedExportException.class, () -> parser.parse("{not json"));
    assertThrows(MalformedExportException.class, () -> parser.parse("[1,2]"));
    assertThrows(MalformedExportException.class, () -> parser.parse("{\"other\":1}"));
    assertThrows(MalformedExportException.class, () -> parser.parse("{\"nodes\":{}}"));
    assertThrows(MalformedExportException.class, () -> parser.parse("{\"cypherScript\":42}"));
  }

  @Test
  void parsesCypherScriptAlongsideRecords() {
    ExportDocument doc =
        parser.parse("{\"nodes\":[],\"cypherScript\":\"CREATE (n:A);\\nCREATE (m:B);\"}");
    assertTrue(doc.propertyGraph().isPresent());
    assertEquals("CREATE (n:A);\nCREATE (m:B);", doc.cypherScript().orElseThrow());
  }

  @Test
  @DisplayName("Tensor part keeps raw buffers without checking shapes")
  void parsesTensorPart() {
    ExportDocument doc =
        parser.parse(
            "{\"nodeFeatures\":{\"Person\":[[1,2],[3]]},"
                + "\"nodeLabels\":{\"Person\":[\"Alice\",\"Bob\"]},"
                + "\"edgeIndices\":{\"Person,knows,Person\":[[0],[5]]},"
                + "\"edgeFeatures\":{\"Person,knows,Person\":[]}}");

    TensorExport tensor = doc.tensor().orElseThrow();
    assertEquals(2, tensor.nodeFeatures().get("Person").size());
    assertEquals(1, tensor.nodeFeatures().get("Person").get(1).length);
    assertEquals(List.of("Alice", "Bob"), tensor.nodeLabels().get("Person"));
    TripletKey key = new TripletKey("Person", "knows", "Person");
    assertEquals(5L, tensor.edgeIndices().get(key).get(1)[0]);
    assertTrue(tensor.edgeFeatures().get(key).isEmpty());
    assertTrue(doc.propertyGraph().isEmpty());
  }

  @Test
  void rejectsBadTensorShapes() {
    assertThrows(
        MalformedExportException.class,
        () -> parser.parse("{\"nodeFeatures\":{\"A\":[[\"x\"]]}}"));
    assertThrows(
        MalformedExportException.class, () -> parser.parse("{\"nodeFeatures\":{\"A\":[1,2]}}"));
    assertThrows(
        MalformedExportException.class,
        () -> parser.parse("{\"nodeFeatures\":{},\"edgeIndices\":{\"A,rel\":[[0],[0]]}}"));
    assertThrows(
        MalformedExportException.class,
        () -> parser.parse("{\"nodeFeatures\":{},\"edgeIndices\":{\"A,r,A\":[[0.5],[0]]}}"));
  }

  @Test
  void readsFromFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("export.json");
    Files.writeString(file, "{\"nodes\":[{\"id\":7}],\"relationships\":[]}");
    assertEquals(1, parser.parse(file).propertyGraph().orElseThrow().nodes().size());
    assertThrows(IoException.class, () -> parser.parse(dir.resolve("missing.json")));
  }
}
