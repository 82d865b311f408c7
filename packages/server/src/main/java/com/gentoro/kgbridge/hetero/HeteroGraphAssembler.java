package com.gentoro.kgbridge.hetero;

import com.gentoro.kgbridge.exception.ShapeMismatchException;
import com.gentoro.kgbridge.export.TensorExport;
import com.gentoro.kgbridge.export.TripletKey;
import com.gentoro.kgbridge.logging.LoggingService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Turns the raw buffers of a tensor export into a {@link HeteroGraph}. Every shape problem is
 * reported as a {@link ShapeMismatchException}; indices are never clamped and nothing partial is
 * returned.
 */
public class HeteroGraphAssembler {
  private static final Logger log = LoggingService.getLogger(HeteroGraphAssembler.class);

  public HeteroGraph assemble(TensorExport export) {
    Map<String, HeteroNodeStore> nodes = new LinkedHashMap<>();
    export
        .nodeFeatures()
        .forEach(
            (type, rows) -> {
              FloatMatrix features = FloatMatrix.fromRows(rows, "node features of '" + type + "'");
              List<String> labels = export.nodeLabels().get(type);
              if (labels != null && labels.size() != features.rows()) {
                throw new ShapeMismatchException(
                    "Node type '"
                        + type
                        + "' has "
                        + labels.size()
                        + " labels for "
                        + features.rows()
                        + " feature rows",
                    Map.of("type", type));
              }
              nodes.put(type, new HeteroNodeStore(type, features, labels));
            });
    export.nodeLabels().keySet().stream()
        .filter(type -> !nodes.containsKey(type))
        .forEach(type -> log.warn("Ignoring labels of node type '{}' without features", type));

    Map<TripletKey, HeteroEdgeStore> edges = new LinkedHashMap<>();
    export
        .edgeIndices()
        .forEach(
            (triplet, rows) -> {
              IndexMatrix index = toIndex(triplet, rows);
              checkBounds(triplet, index, nodes);
              FloatMatrix features = edgeFeatures(triplet, export.edgeFeatures().get(triplet), index);
              edges.put(triplet, new HeteroEdgeStore(triplet, index, features));
            });
    export.edgeFeatures().keySet().stream()
        .filter(triplet -> !edges.containsKey(triplet))
        .forEach(t -> log.warn("Ignoring edge features of {} without edge indices", t));

    HeteroGraph graph = new HeteroGraph(nodes, edges);
    log.info("Assembled heterogeneous graph: {}", graph);
    return graph;
  }

  private static IndexMatrix toIndex(TripletKey triplet, List<long[]> rows) {
    if (rows.size() != 2 || rows.get(0).length != rows.get(1).length) {
      throw new ShapeMismatchException(
          "Edge index of " + triplet + " must be exactly two rows of equal length",
          Map.of("triplet", triplet.toString(), "rows", rows.size()));
    }
    return new IndexMatrix(rows.get(0), rows.get(1));
  }

  private static void checkBounds(
      TripletKey triplet, IndexMatrix index, Map<String, HeteroNodeStore> nodes) {
    long srcRows = rowCount(nodes, triplet.source());
    long dstRows = rowCount(nodes, triplet.destination());
    for (int e = 0; e < index.edgeCount(); e++) {
      checkIndex(triplet, "source", triplet.source(), index.source(e), srcRows, e);
      checkIndex(triplet, "destination", triplet.destination(), index.destination(e), dstRows, e);
    }
  }

  private static long rowCount(Map<String, HeteroNodeStore> nodes, String type) {
    HeteroNodeStore store = nodes.get(type);
    return store == null ? 0 : store.nodeCount();
  }

  private static void checkIndex(
      TripletKey triplet, String side, String type, long value, long rows, int edge) {
    if (value < 0 || value >= rows) {
      throw new ShapeMismatchException(
          "Edge "
              + edge
              + " of "
              + triplet
              + " has "
              + side
              + " index "
              + value
              + " outside node type '"
              + type
              + "' with "
              + rows
              + " rows",
          Map.of("triplet", triplet.toString(), "edge", edge, "index", value));
    }
  }

  private static FloatMatrix edgeFeatures(
      TripletKey triplet, List<double[]> rows, IndexMatrix index) {
    if (rows == null || rows.isEmpty() || rows.stream().allMatch(r -> r.length == 0)) {
      return null;
    }
    FloatMatrix features = FloatMatrix.fromRows(rows, "edge features of " + triplet);
    if (features.rows() != index.edgeCount()) {
      throw new ShapeMismatchException(
          "Edge features of "
              + triplet
              + " have "
              + features.rows()
              + " rows for "
              + index.edgeCount()
              + " edges",
          Map.of("triplet", triplet.toString()));
    }
    return features;
  }
}
