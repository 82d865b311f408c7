package com.gentoro.kgbridge.hetero;

import java.util.List;
import java.util.Optional;

/** Feature matrix of one node type; row order is the per-type node index. */
public final class HeteroNodeStore {
  private final String type;
  private final FloatMatrix features;
  private final List<String> labels;

  HeteroNodeStore(String type, FloatMatrix features, List<String> labels) {
    this.type = type;
    this.features = features;
    this.labels = labels == null ? null : List.copyOf(labels);
  }

  public String type() {
    return type;
  }

  public FloatMatrix features() {
    return features;
  }

  public int nodeCount() {
    return features.rows();
  }

  public int featureCount() {
    return features.cols();
  }

  /** Row-aligned display labels, when the export supplied them. */
  public Optional<List<String>> labels() {
    return Optional.ofNullable(labels);
  }
}
