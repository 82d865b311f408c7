package com.gentoro.kgbridge.export;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A node from a property-graph export: external identifier, labels and properties. */
public final class ExportedNode {
  /** Label used when the export declares none. */
  public static final String DEFAULT_LABEL = "Node";

  private final PropertyValue id;
  private final List<String> labels;
  private final Map<String, PropertyValue> properties;

  public ExportedNode(PropertyValue id, List<String> labels, Map<String, PropertyValue> properties) {
    this.id = Objects.requireNonNull(id, "id");
    LinkedHashSet<String> distinct = new LinkedHashSet<>();
    if (labels != null) {
      for (String label : labels) {
        if (label != null && !label.isBlank()) distinct.add(label);
      }
    }
    if (distinct.isEmpty()) distinct.add(DEFAULT_LABEL);
    this.labels = Collections.unmodifiableList(new ArrayList<>(distinct));
    this.properties =
        Collections.unmodifiableMap(
            properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties));
  }

  public PropertyValue getId() {
    return id;
  }

  public List<String> getLabels() {
    return labels;
  }

  public Map<String, PropertyValue> getProperties() {
    return properties;
  }

  /** The {@code label} property when present, else the external identifier; for progress lines. */
  public String displayName() {
    PropertyValue label = properties.get("label");
    return label != null && !label.isNull() ? label.toString() : id.toString();
  }

  @Override
  public String toString() {
    return "ExportedNode{id=" + id + ", labels=" + labels + '}';
  }
}
