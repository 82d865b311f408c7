package com.gentoro.kgbridge.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.export.PropertyValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StoreValuesTest {

  @Test
  void keepsScalarsAndScalarListsAndDropsNulls() {
    Map<String, PropertyValue> props = new LinkedHashMap<>();
    props.put("name", PropertyValue.ofString("Alice"));
    props.put("age", PropertyValue.ofInteger(30));
    props.put("score", PropertyValue.ofFloat(0.5));
    props.put("ok", PropertyValue.ofBoolean(true));
    props.put("tags", PropertyValue.ofList(List.of(PropertyValue.ofString("a"))));
    props.put("gone", PropertyValue.ofNull());

    Map<String, Object> out = new StoreValues(false).toStoreProperties(props);

    assertEquals(List.of("name", "age", "score", "ok", "tags"), List.copyOf(out.keySet()));
    assertEquals(30L, out.get("age"));
    assertEquals(List.of("a"), out.get("tags"));
  }

  @Test
  void coercesNestedValuesToJsonText() {
    Map<String, PropertyValue> props = new LinkedHashMap<>();
    props.put("meta", PropertyValue.ofObject("{\"x\":1}"));
    props.put(
        "matrix",
        PropertyValue.ofList(
            List.of(
                PropertyValue.ofList(List.of(PropertyValue.ofInteger(1))),
                PropertyValue.ofList(List.of(PropertyValue.ofInteger(2))))));

    Map<String, Object> out = new StoreValues(true).toStoreProperties(props);

    assertEquals("{\"x\":1}", out.get("meta"));
    assertEquals("[[1],[2]]", out.get("matrix"));
  }

  @Test
  void rejectsNestedValuesWhenCoercionIsOff() {
    StoreValues strict = new StoreValues(false);
    assertThrows(
        ValidationException.class,
        () -> strict.toStoreProperties(Map.of("meta", PropertyValue.ofObject("{}"))));
    assertThrows(
        ValidationException.class,
        () ->
            strict.toStoreProperties(
                Map.of("list", PropertyValue.ofList(List.of(PropertyValue.ofObject("{}"))))));
  }

  @Test
  void identityValueIsPlain() {
    assertEquals(7L, StoreValues.identityValue(PropertyValue.ofInteger(7)));
    assertEquals("n1", StoreValues.identityValue(PropertyValue.ofString("n1")));
  }
}
