package com.gentoro.kgbridge.store.neo4j;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Entity;
import org.neo4j.driver.types.IsoDuration;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Point;

/**
 * Flattens driver values into JSON-friendly Java objects: entities become their property maps,
 * paths become the list of their nodes, temporal and spatial values become strings.
 */
final class Neo4jValues {
  private Neo4jValues() {}

  static Map<String, Object> toRow(Record record) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String key : record.keys()) {
      row.put(key, plain(record.get(key).asObject()));
    }
    return row;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> toPropertyMap(Value value) {
    Object plain = plain(value.asObject());
    return plain instanceof Map ? (Map<String, Object>) plain : Map.of();
  }

  static Object plain(Object o) {
    if (o == null) return null;
    if (o instanceof Entity entity) {
      return plainMap(entity.asMap());
    }
    if (o instanceof Path path) {
      List<Object> nodes = new ArrayList<>();
      for (Node node : path.nodes()) nodes.add(plainMap(node.asMap()));
      return nodes;
    }
    if (o instanceof Map<?, ?> map) {
      Map<String, Object> out = new LinkedHashMap<>();
      map.forEach((k, v) -> out.put(String.valueOf(k), plain(v)));
      return out;
    }
    if (o instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object item : list) out.add(plain(item));
      return out;
    }
    if (o instanceof TemporalAccessor || o instanceof IsoDuration || o instanceof Point) {
      return o.toString();
    }
    return o;
  }

  private static Map<String, Object> plainMap(Map<String, Object> props) {
    Map<String, Object> out = new LinkedHashMap<>();
    props.forEach((k, v) -> out.put(k, plain(v)));
    return out;
  }
}
