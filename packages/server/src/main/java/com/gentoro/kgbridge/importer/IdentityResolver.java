package com.gentoro.kgbridge.importer;

import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.export.ExportedNode;
import com.gentoro.kgbridge.export.ExportedRelationship;
import com.gentoro.kgbridge.export.PropertyValue;
import com.gentoro.kgbridge.store.StoreValues;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps external identifiers onto the marker property written to every created node. The store
 * resolves relationship endpoints by marker lookup; the identifiers remembered here decide whether
 * a relationship may be written at all and explain why an endpoint was not found.
 *
 * <p>One instance per import run.
 */
public class IdentityResolver {
  private final String markerKey;
  private final Set<Object> created = new HashSet<>();

  public IdentityResolver(String markerKey) {
    if (markerKey == null || markerKey.isBlank()) {
      throw new ValidationException("Identity marker property must not be blank");
    }
    this.markerKey = markerKey;
  }

  /**
   * Store properties of {@code node} with the marker added.
   *
   * @throws ValidationException when the node already carries a property named like the marker
   */
  public Map<String, Object> withMarker(ExportedNode node, Map<String, Object> properties) {
    if (node.getProperties().containsKey(markerKey)) {
      throw new ValidationException(
          "Property '" + markerKey + "' collides with the identity marker");
    }
    Map<String, Object> out = new LinkedHashMap<>(properties);
    out.put(markerKey, StoreValues.identityValue(node.getId()));
    return out;
  }

  public Object markerValue(PropertyValue id) {
    return StoreValues.identityValue(id);
  }

  public void recordCreated(PropertyValue id) {
    created.add(StoreValues.identityValue(id));
  }

  public boolean wasCreated(PropertyValue id) {
    return created.contains(StoreValues.identityValue(id));
  }

  /** Why a relationship found no endpoints. */
  public String describeUnresolved(ExportedRelationship rel) {
    boolean start = wasCreated(rel.getStartNodeId());
    boolean end = wasCreated(rel.getEndNodeId());
    if (!start && !end) {
      return "start node " + rel.getStartNodeId() + " and end node " + rel.getEndNodeId()
          + " were not created in this import";
    }
    if (!start) return "start node " + rel.getStartNodeId() + " was not created in this import";
    if (!end) return "end node " + rel.getEndNodeId() + " was not created in this import";
    return "endpoints not found in the store by " + markerKey;
  }
}
