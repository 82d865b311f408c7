package com.gentoro.kgbridge.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.kgbridge.exception.IoException;
import com.gentoro.kgbridge.exception.MalformedExportException;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Reads a tool-produced graph export into an {@link ExportDocument}.
 *
 * <p>Only structural presence is checked: every node needs an {@code id}, every relationship both
 * endpoint identifiers, and tensor buffers need the right JSON shapes. Missing labels and
 * relationship types fall back to {@link ExportedNode#DEFAULT_LABEL} and {@link
 * ExportedRelationship#DEFAULT_TYPE}. Widths, index bounds and property types are not checked
 * here.
 */
public class ExportDocumentParser {
  private static final Logger log = LoggingService.getLogger(ExportDocumentParser.class);

  private final ObjectMapper mapper;

  public ExportDocumentParser() {
    this(JacksonUtility.getJsonMapper());
  }

  public ExportDocumentParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public ExportDocument parse(Path path) {
    log.debug("Reading export from {}", path.toAbsolutePath());
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in);
    } catch (NoSuchFileException e) {
      throw new IoException("Export file not found: " + path, e);
    } catch (IOException e) {
      throw new IoException("Failed to read export file: " + path, e);
    }
  }

  public ExportDocument parse(InputStream in) {
    try {
      return parse(mapper.readTree(in));
    } catch (JsonProcessingException e) {
      throw new MalformedExportException("Export is not well-formed JSON", e);
    } catch (IOException e) {
      throw new IoException("Failed to read export stream", e);
    }
  }

  public ExportDocument parse(String json) {
    try {
      return parse(mapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new MalformedExportException("Export is not well-formed JSON", e);
    }
  }

  public ExportDocument parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new MalformedExportException("Export must be a JSON object");
    }

    PropertyGraphExport graph = null;
    if (root.has("nodes") || root.has("relationships")) {
      graph =
          new PropertyGraphExport(
              readArray(root, "nodes", this::readNode),
              readArray(root, "relationships", this::readRelationship));
    }

    String script = null;
    if (root.has("cypherScript") && !root.get("cypherScript").isNull()) {
      JsonNode s = root.get("cypherScript");
      if (!s.isTextual()) {
        throw new MalformedExportException("'cypherScript' must be a string");
      }
      script = s.asText();
    }

    TensorExport tensor = null;
    if (root.has("nodeFeatures") || root.has("edgeIndices")) {
      tensor = readTensor(root);
    }

    if (graph == null && script == null && tensor == null) {
      throw new MalformedExportException(
          "Export contains none of: nodes, relationships, cypherScript, nodeFeatures, edgeIndices");
    }

    if (graph != null) {
      log.debug(
          "Parsed property graph with {} nodes and {} relationships",
          graph.nodes().size(),
          graph.relationships().size());
    }
    return new ExportDocument(graph, script, tensor);
  }

  // ---------------------------------------------------------------------------
  // Property-graph part
  // ---------------------------------------------------------------------------

  private <T> List<T> readArray(JsonNode root, String field, Function<IndexedNode, T> reader) {
    JsonNode array = root.get(field);
    if (array == null || array.isNull()) return List.of();
    if (!array.isArray()) {
      throw new MalformedExportException("'" + field + "' must be an array");
    }
    List<T> out = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      out.add(reader.apply(new IndexedNode(i, array.get(i))));
    }
    return out;
  }

  private ExportedNode readNode(IndexedNode entry) {
    JsonNode n = entry.node();
    if (!n.isObject()) {
      throw new MalformedExportException(
          "Node entry must be an object", Map.of("index", entry.index()));
    }
    PropertyValue id = readIdentifier(n, "id", "node", entry.index());

    List<String> labels = new ArrayList<>();
    JsonNode labelsNode = n.get("labels");
    if (labelsNode != null && labelsNode.isArray()) {
      for (JsonNode l : labelsNode) {
        if (l.isTextual()) labels.add(l.asText());
      }
    } else if (labelsNode != null && labelsNode.isTextual()) {
      labels.add(labelsNode.asText());
    }
    return new ExportedNode(id, labels, readProperties(n, "node", entry.index()));
  }

  private ExportedRelationship readRelationship(IndexedNode entry) {
    JsonNode r = entry.node();
    if (!r.isObject()) {
      throw new MalformedExportException(
          "Relationship entry must be an object", Map.of("index", entry.index()));
    }
    PropertyValue start = readIdentifier(r, "startNodeId", "relationship", entry.index());
    PropertyValue end = readIdentifier(r, "endNodeId", "relationship", entry.index());
    JsonNode type = r.get("type");
    String typeName = type != null && type.isTextual() ? type.asText() : null;
    return new ExportedRelationship(
        typeName, start, end, readProperties(r, "relationship", entry.index()));
  }

  private PropertyValue readIdentifier(JsonNode owner, String field, String kind, int index) {
    JsonNode id = owner.get(field);
    if (id == null || id.isNull() || !(id.isTextual() || id.isNumber())) {
      throw new MalformedExportException(
          "Missing or invalid '" + field + "' on " + kind,
          Map.of("index", index, "field", field));
    }
    return PropertyValue.fromJson(id);
  }

  private Map<String, PropertyValue> readProperties(JsonNode owner, String kind, int index) {
    JsonNode props = owner.get("properties");
    Map<String, PropertyValue> out = new LinkedHashMap<>();
    if (props == null || props.isNull()) return out;
    if (!props.isObject()) {
      throw new MalformedExportException(
          "'properties' must be an object on " + kind, Map.of("index", index));
    }
    Iterator<Map.Entry<String, JsonNode>> it = props.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), PropertyValue.fromJson(e.getValue()));
    }
    return out;
  }

  private record IndexedNode(int index, JsonNode node) {}

  // ---------------------------------------------------------------------------
  // Tensor part
  // ---------------------------------------------------------------------------

  private TensorExport readTensor(JsonNode root) {
    Map<String, List<double[]>> nodeFeatures = new LinkedHashMap<>();
    forEachField(
        root,
        "nodeFeatures",
        (type, rows) -> nodeFeatures.put(type, readNumberRows(rows, "nodeFeatures." + type)));

    Map<String, List<String>> nodeLabels = new LinkedHashMap<>();
    forEachField(
        root,
        "nodeLabels",
        (type, labels) -> {
          if (!labels.isArray()) {
            throw new MalformedExportException("'nodeLabels." + type + "' must be an array");
          }
          List<String> out = new ArrayList<>(labels.size());
          for (JsonNode l : labels) out.add(l.isNull() ? null : l.asText());
          nodeLabels.put(type, out);
        });

    Map<TripletKey, List<long[]>> edgeIndices = new LinkedHashMap<>();
    forEachField(
        root,
        "edgeIndices",
        (key, rows) -> edgeIndices.put(TripletKey.parse(key), readIndexRows(rows, key)));

    Map<TripletKey, List<double[]>> edgeFeatures = new LinkedHashMap<>();
    forEachField(
        root,
        "edgeFeatures",
        (key, rows) ->
            edgeFeatures.put(TripletKey.parse(key), readNumberRows(rows, "edgeFeatures." + key)));

    return new TensorExport(nodeFeatures, nodeLabels, edgeIndices, edgeFeatures);
  }

  private interface FieldVisitor {
    void visit(String name, JsonNode value);
  }

  private void forEachField(JsonNode root, String field, FieldVisitor visitor) {
    JsonNode map = root.get(field);
    if (map == null || map.isNull()) return;
    if (!map.isObject()) {
      throw new MalformedExportException("'" + field + "' must be an object");
    }
    Iterator<Map.Entry<String, JsonNode>> it = map.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      visitor.visit(e.getKey(), e.getValue());
    }
  }

  private List<double[]> readNumberRows(JsonNode rows, String path) {
    if (!rows.isArray()) {
      throw new MalformedExportException("'" + path + "' must be an array of rows");
    }
    List<double[]> out = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      if (!row.isArray()) {
        throw new MalformedExportException("'" + path + "' rows must be arrays");
      }
      double[] values = new double[row.size()];
      for (int i = 0; i < row.size(); i++) {
        JsonNode cell = row.get(i);
        if (!cell.isNumber()) {
          throw new MalformedExportException(
              "'" + path + "' contains a non-numeric cell", Map.of("value", cell.toString()));
        }
        values[i] = cell.doubleValue();
      }
      out.add(values);
    }
    return out;
  }

  private List<long[]> readIndexRows(JsonNode rows, String key) {
    if (!rows.isArray()) {
      throw new MalformedExportException("'edgeIndices." + key + "' must be an array of rows");
    }
    List<long[]> out = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      if (!row.isArray()) {
        throw new MalformedExportException("'edgeIndices." + key + "' rows must be arrays");
      }
      long[] values = new long[row.size()];
      for (int i = 0; i < row.size(); i++) {
        JsonNode cell = row.get(i);
        if (!cell.isIntegralNumber()) {
          throw new MalformedExportException(
              "'edgeIndices." + key + "' contains a non-integer index",
              Map.of("value", cell.toString()));
        }
        values[i] = cell.longValue();
      }
      out.add(values);
    }
    return out;
  }
}
