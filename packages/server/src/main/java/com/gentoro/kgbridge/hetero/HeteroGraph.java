package com.gentoro.kgbridge.hetero;

import com.gentoro.kgbridge.export.TripletKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable heterogeneous graph: node stores keyed by type and edge stores keyed by triplet, both
 * in export order. Every edge index is within its node group's row count.
 */
public final class HeteroGraph {
  private final Map<String, HeteroNodeStore> nodes;
  private final Map<TripletKey, HeteroEdgeStore> edges;

  HeteroGraph(Map<String, HeteroNodeStore> nodes, Map<TripletKey, HeteroEdgeStore> edges) {
    this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
  }

  public List<String> nodeTypes() {
    return new ArrayList<>(nodes.keySet());
  }

  public List<TripletKey> edgeTypes() {
    return new ArrayList<>(edges.keySet());
  }

  public Optional<HeteroNodeStore> node(String type) {
    return Optional.ofNullable(nodes.get(type));
  }

  public Optional<HeteroEdgeStore> edge(TripletKey triplet) {
    return Optional.ofNullable(edges.get(triplet));
  }

  /** Multi-line structural summary: node and feature counts per type, edge counts per triplet. */
  public String summary() {
    StringBuilder sb = new StringBuilder();
    sb.append("=".repeat(50)).append('\n');
    sb.append("Heterogeneous Graph Summary\n");
    sb.append("=".repeat(50)).append('\n');
    sb.append("\nNode Types:\n");
    for (HeteroNodeStore n : nodes.values()) {
      sb.append("  - ")
          .append(n.type())
          .append(": ")
          .append(n.nodeCount())
          .append(" nodes, ")
          .append(n.featureCount())
          .append(" features\n");
      n.labels().ifPresent(l -> sb.append("    Labels: ").append(l).append('\n'));
    }
    sb.append("\nEdge Types:\n");
    for (HeteroEdgeStore e : edges.values()) {
      sb.append("  - ").append(e.triplet()).append(": ").append(e.edgeCount()).append(" edges");
      e.features().ifPresent(f -> sb.append(", ").append(f.cols()).append(" features"));
      sb.append('\n');
    }
    sb.append('\n').append("=".repeat(50));
    return sb.toString();
  }

  @Override
  public String toString() {
    return "HeteroGraph{nodeTypes=" + nodes.keySet() + ", edgeTypes=" + edges.keySet() + '}';
  }
}
