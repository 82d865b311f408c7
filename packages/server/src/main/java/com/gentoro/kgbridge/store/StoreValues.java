package com.gentoro.kgbridge.store;

import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.export.PropertyValue;
import com.gentoro.kgbridge.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts exported property values into what a property-graph store can hold: scalars and
 * homogeneous scalar lists. Nulls are dropped. Nested objects, and lists containing objects or
 * lists, are written as JSON text when {@code coerceObjects} is on and rejected otherwise.
 */
public final class StoreValues {
  private final boolean coerceObjects;

  public StoreValues(boolean coerceObjects) {
    this.coerceObjects = coerceObjects;
  }

  public Map<String, Object> toStoreProperties(Map<String, PropertyValue> properties) {
    Map<String, Object> out = new LinkedHashMap<>();
    properties.forEach(
        (key, value) -> {
          Object converted = toStoreValue(key, value);
          if (converted != null) out.put(key, converted);
        });
    return out;
  }

  public Object toStoreValue(String key, PropertyValue value) {
    if (value == null || value.isNull()) return null;
    switch (value.kind()) {
      case OBJECT:
        return nested(key, value, value.raw());
      case LIST:
        for (PropertyValue item : value.items()) {
          if (!item.isScalar() || item.isNull()) {
            return nested(key, value, JacksonUtility.toCompactJson(value.raw()));
          }
        }
        return value.raw();
      default:
        return value.raw();
    }
  }

  private Object nested(String key, PropertyValue value, Object json) {
    if (!coerceObjects) {
      throw new ValidationException(
          "Property '" + key + "' holds a nested " + value.kind().name().toLowerCase()
              + " value the store cannot hold");
    }
    return json;
  }

  /** Plain value of an external identifier, as stored in the identity marker. */
  public static Object identityValue(PropertyValue id) {
    return id.raw();
  }
}
