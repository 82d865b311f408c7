package com.gentoro.kgbridge.importer;

import com.gentoro.kgbridge.store.GraphSession;
import java.util.List;

/** Store-wide counts and names, captured before and after an import. */
public record GraphStats(
    long nodeCount, long relationshipCount, List<String> labels, List<String> relationshipTypes) {

  public GraphStats {
    labels = List.copyOf(labels);
    relationshipTypes = List.copyOf(relationshipTypes);
  }

  public static GraphStats collect(GraphSession session) {
    return new GraphStats(
        session.countNodes(),
        session.countRelationships(),
        session.labels(),
        session.relationshipTypes());
  }
}
