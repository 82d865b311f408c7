package com.gentoro.kgbridge.export;

import java.util.List;

/** Nodes and relationships of a property-graph export, in input order. */
public record PropertyGraphExport(
    List<ExportedNode> nodes, List<ExportedRelationship> relationships) {

  public PropertyGraphExport {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
  }
}
