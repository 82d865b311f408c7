package com.gentoro.kgbridge.export;

import java.util.Optional;

/**
 * A parsed export. A producer may emit more than one representation in the same file (for example
 * structured records together with a ready-made Cypher script), so each part is optional; the
 * parser guarantees at least one is present.
 */
public final class ExportDocument {
  private final PropertyGraphExport propertyGraph;
  private final String cypherScript;
  private final TensorExport tensor;

  public ExportDocument(
      PropertyGraphExport propertyGraph, String cypherScript, TensorExport tensor) {
    this.propertyGraph = propertyGraph;
    this.cypherScript = cypherScript;
    this.tensor = tensor;
  }

  public Optional<PropertyGraphExport> propertyGraph() {
    return Optional.ofNullable(propertyGraph);
  }

  public Optional<String> cypherScript() {
    return Optional.ofNullable(cypherScript).filter(s -> !s.isBlank());
  }

  public Optional<TensorExport> tensor() {
    return Optional.ofNullable(tensor);
  }
}
