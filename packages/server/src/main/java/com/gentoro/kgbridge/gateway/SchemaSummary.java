package com.gentoro.kgbridge.gateway;

import java.util.List;
import java.util.Map;

/** Snapshot of the store's schema, built fresh for every request. */
public record SchemaSummary(
    List<String> labels,
    List<String> relationshipTypes,
    List<String> propertyKeys,
    Map<String, List<String>> labelProperties,
    String namePropertyRule) {

  public static final String NAME_PROPERTY_RULE =
      "Use `label` property for node names (n.label CONTAINS '...') when present.";
}
