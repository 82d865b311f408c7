package com.gentoro.kgbridge.gateway;

import com.gentoro.kgbridge.store.GraphSession;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads labels, relationship types and property keys, plus sampled per-label property keys. */
public class SchemaIntrospector {
  private final int maxLabels;
  private final int sampleSize;
  private final int maxKeys;

  public SchemaIntrospector() {
    this(30, 50, 20);
  }

  public SchemaIntrospector(int maxLabels, int sampleSize, int maxKeys) {
    this.maxLabels = maxLabels;
    this.sampleSize = sampleSize;
    this.maxKeys = maxKeys;
  }

  public SchemaSummary introspect(GraphSession session) {
    List<String> labels = session.labels();
    Map<String, List<String>> labelProperties = new LinkedHashMap<>();
    for (String label : labels.subList(0, Math.min(maxLabels, labels.size()))) {
      labelProperties.put(label, session.frequentPropertyKeys(label, sampleSize, maxKeys));
    }
    return new SchemaSummary(
        labels,
        session.relationshipTypes(),
        session.propertyKeys(),
        labelProperties,
        SchemaSummary.NAME_PROPERTY_RULE);
  }
}
