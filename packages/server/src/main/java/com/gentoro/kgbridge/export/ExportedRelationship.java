package com.gentoro.kgbridge.export;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A directed, typed relationship between two exported nodes, addressed by external identifiers. */
public final class ExportedRelationship {
  /** Relationship type used when the export declares none. */
  public static final String DEFAULT_TYPE = "RELATED_TO";

  private final String type;
  private final PropertyValue startNodeId;
  private final PropertyValue endNodeId;
  private final Map<String, PropertyValue> properties;

  public ExportedRelationship(
      String type,
      PropertyValue startNodeId,
      PropertyValue endNodeId,
      Map<String, PropertyValue> properties) {
    this.type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
    this.startNodeId = Objects.requireNonNull(startNodeId, "startNodeId");
    this.endNodeId = Objects.requireNonNull(endNodeId, "endNodeId");
    this.properties =
        Collections.unmodifiableMap(
            properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties));
  }

  public String getType() {
    return type;
  }

  public PropertyValue getStartNodeId() {
    return startNodeId;
  }

  public PropertyValue getEndNodeId() {
    return endNodeId;
  }

  public Map<String, PropertyValue> getProperties() {
    return properties;
  }

  @Override
  public String toString() {
    return "[" + type + "]: " + startNodeId + " → " + endNodeId;
  }
}
