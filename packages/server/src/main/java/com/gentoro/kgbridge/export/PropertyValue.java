package com.gentoro.kgbridge.export;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single property value carried by an exported node or relationship.
 *
 * <p>Scalars keep their JSON kind (string, integer, float, boolean, null). Arrays become {@link
 * Kind#LIST} and nested objects are kept verbatim as JSON text under {@link Kind#OBJECT}; whether
 * the target store accepts them is decided by the store adapter, not here.
 */
public final class PropertyValue {

  public enum Kind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    NULL,
    LIST,
    OBJECT
  }

  private static final PropertyValue NULL_VALUE = new PropertyValue(Kind.NULL, null);

  private final Kind kind;
  private final Object value;

  private PropertyValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static PropertyValue ofString(String value) {
    return value == null ? NULL_VALUE : new PropertyValue(Kind.STRING, value);
  }

  public static PropertyValue ofInteger(long value) {
    return new PropertyValue(Kind.INTEGER, value);
  }

  public static PropertyValue ofFloat(double value) {
    return new PropertyValue(Kind.FLOAT, value);
  }

  public static PropertyValue ofBoolean(boolean value) {
    return new PropertyValue(Kind.BOOLEAN, value);
  }

  public static PropertyValue ofNull() {
    return NULL_VALUE;
  }

  public static PropertyValue ofList(List<PropertyValue> values) {
    return new PropertyValue(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public static PropertyValue ofObject(String json) {
    return new PropertyValue(Kind.OBJECT, Objects.requireNonNull(json, "json"));
  }

  /** Map a Jackson tree node onto the closest property kind. */
  public static PropertyValue fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return NULL_VALUE;
    if (node.isTextual()) return ofString(node.asText());
    if (node.isBoolean()) return ofBoolean(node.booleanValue());
    if (node.isIntegralNumber()) {
      if (node.canConvertToLong()) return ofInteger(node.longValue());
      return ofFloat(node.doubleValue());
    }
    if (node.isNumber()) return ofFloat(node.doubleValue());
    if (node.isArray()) {
      List<PropertyValue> items = new ArrayList<>(node.size());
      for (JsonNode item : node) items.add(fromJson(item));
      return ofList(items);
    }
    return ofObject(node.toString());
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean isScalar() {
    return kind != Kind.LIST && kind != Kind.OBJECT;
  }

  /**
   * Plain Java representation: {@link String}, {@link Long}, {@link Double}, {@link Boolean},
   * {@code null}, a {@link List} of plain values, or the JSON text of an object.
   */
  public Object raw() {
    if (kind == Kind.LIST) {
      @SuppressWarnings("unchecked")
      List<PropertyValue> items = (List<PropertyValue>) value;
      List<Object> out = new ArrayList<>(items.size());
      for (PropertyValue item : items) out.add(item.raw());
      return out;
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  public List<PropertyValue> items() {
    return kind == Kind.LIST ? (List<PropertyValue>) value : List.of();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PropertyValue)) return false;
    PropertyValue that = (PropertyValue) o;
    return kind == that.kind && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return kind == Kind.NULL ? "null" : String.valueOf(raw());
  }
}
