package com.gentoro.kgbridge.store.memory;

import com.gentoro.kgbridge.exception.UnsupportedFeatureException;
import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.memory.InMemoryGraphStore.StoredNode;
import com.gentoro.kgbridge.store.memory.InMemoryGraphStore.StoredRelationship;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

class InMemoryGraphSession implements GraphSession {
  private final InMemoryGraphStore store;

  InMemoryGraphSession(InMemoryGraphStore store) {
    this.store = store;
  }

  @Override
  public void createNode(List<String> labels, Map<String, Object> properties) {
    if (labels == null || labels.isEmpty()) {
      throw new ValidationException("At least one label is required");
    }
    properties.forEach(InMemoryGraphSession::checkStorable);
    synchronized (store.lock) {
      store.nodes.add(new StoredNode(store.nextId++, labels, properties));
    }
  }

  @Override
  public long createRelationship(
      String identityKey,
      Object startId,
      Object endId,
      String type,
      Map<String, Object> properties) {
    properties.forEach(InMemoryGraphSession::checkStorable);
    synchronized (store.lock) {
      List<StoredNode> starts = findBy(identityKey, startId);
      List<StoredNode> ends = findBy(identityKey, endId);
      long created = 0;
      for (StoredNode a : starts) {
        for (StoredNode b : ends) {
          store.relationships.add(
              new StoredRelationship(a.id, b.id, type, new LinkedHashMap<>(properties)));
          created++;
        }
      }
      return created;
    }
  }

  private List<StoredNode> findBy(String key, Object value) {
    List<StoredNode> out = new ArrayList<>();
    for (StoredNode n : store.nodes) {
      if (Objects.equals(n.properties.get(key), value)) out.add(n);
    }
    return out;
  }

  @Override
  public void execute(String statement) {
    throw new UnsupportedFeatureException("The in-memory store cannot execute Cypher statements");
  }

  @Override
  public long clearAll() {
    synchronized (store.lock) {
      long deleted = store.nodes.size();
      store.nodes.clear();
      store.relationships.clear();
      return deleted;
    }
  }

  @Override
  public long removeProperty(String key) {
    synchronized (store.lock) {
      long touched = 0;
      for (StoredNode n : store.nodes) {
        if (n.properties.remove(key) != null) touched++;
      }
      return touched;
    }
  }

  @Override
  public List<String> labels() {
    synchronized (store.lock) {
      TreeSet<String> labels = new TreeSet<>();
      store.nodes.forEach(n -> labels.addAll(n.labels));
      return new ArrayList<>(labels);
    }
  }

  @Override
  public List<String> relationshipTypes() {
    synchronized (store.lock) {
      return store.relationships.stream()
          .map(StoredRelationship::type)
          .distinct()
          .sorted()
          .collect(Collectors.toList());
    }
  }

  @Override
  public List<String> propertyKeys() {
    synchronized (store.lock) {
      TreeSet<String> keys = new TreeSet<>();
      store.nodes.forEach(n -> keys.addAll(n.properties.keySet()));
      store.relationships.forEach(r -> keys.addAll(r.properties().keySet()));
      return new ArrayList<>(keys);
    }
  }

  @Override
  public List<String> frequentPropertyKeys(String label, int sampleSize, int limit) {
    synchronized (store.lock) {
      Map<String, Long> counts =
          store.nodes.stream()
              .filter(n -> n.labels.contains(label))
              .limit(sampleSize)
              .flatMap(n -> n.properties.keySet().stream())
              .collect(Collectors.groupingBy(k -> k, LinkedHashMap::new, Collectors.counting()));
      return counts.entrySet().stream()
          .sorted(
              Comparator.<Map.Entry<String, Long>>comparingLong(e -> -e.getValue())
                  .thenComparing(e -> e.getKey()))
          .limit(limit)
          .map(Map.Entry::getKey)
          .collect(Collectors.toList());
    }
  }

  @Override
  public long countNodes() {
    synchronized (store.lock) {
      return store.nodes.size();
    }
  }

  @Override
  public long countRelationships() {
    synchronized (store.lock) {
      return store.relationships.size();
    }
  }

  @Override
  public List<Map<String, Object>> sampleNodes(String label, int limit) {
    synchronized (store.lock) {
      return store.nodes.stream()
          .filter(n -> n.labels.contains(label))
          .limit(limit)
          .map(n -> (Map<String, Object>) new LinkedHashMap<>(n.properties))
          .collect(Collectors.toList());
    }
  }

  @Override
  public List<Map<String, Object>> runReadQuery(String query) {
    throw new UnsupportedFeatureException("The in-memory store cannot run Cypher queries");
  }

  @Override
  public void close() {
    // nothing held per session
  }

  private static void checkStorable(String key, Object value) {
    if (value == null || value instanceof String || value instanceof Number
        || value instanceof Boolean) {
      return;
    }
    if (value instanceof List<?> list) {
      for (Object item : list) {
        if (item instanceof List || item instanceof Map || item == null) {
          throw new ValidationException("Property '" + key + "' holds a nested list value");
        }
      }
      return;
    }
    throw new ValidationException(
        "Property '" + key + "' has unsupported type " + value.getClass().getSimpleName());
  }
}
