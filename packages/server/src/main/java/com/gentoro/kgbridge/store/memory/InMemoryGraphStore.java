package com.gentoro.kgbridge.store.memory;

import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.GraphStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local property graph. Supports every structured operation of {@link GraphSession};
 * Cypher text (script mode, gateway queries) needs a real Cypher engine and is refused.
 */
public class InMemoryGraphStore implements GraphStore {

  /** A stored node. Labels and properties are mutable only through a session. */
  public static final class StoredNode {
    final long id;
    final Set<String> labels;
    final Map<String, Object> properties;

    StoredNode(long id, List<String> labels, Map<String, Object> properties) {
      this.id = id;
      this.labels = new LinkedHashSet<>(labels);
      this.properties = new LinkedHashMap<>(properties);
    }

    public long getId() {
      return id;
    }

    public Set<String> getLabels() {
      return Collections.unmodifiableSet(labels);
    }

    public Map<String, Object> getProperties() {
      return Collections.unmodifiableMap(properties);
    }
  }

  /** A stored directed relationship. */
  public record StoredRelationship(
      long startId, long endId, String type, Map<String, Object> properties) {}

  final Object lock = new Object();
  final List<StoredNode> nodes = new ArrayList<>();
  final List<StoredRelationship> relationships = new ArrayList<>();
  long nextId;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  @Override
  public void initialize() {
    initialized.set(true);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public GraphSession openSession() {
    return new InMemoryGraphSession(this);
  }

  @Override
  public String getDriverName() {
    return "in-memory";
  }

  @Override
  public String describeTarget() {
    return "process memory";
  }

  @Override
  public void shutdown() {
    initialized.set(false);
  }

  /** Snapshot of stored nodes in creation order. */
  public List<StoredNode> nodes() {
    synchronized (lock) {
      return List.copyOf(nodes);
    }
  }

  /** Snapshot of stored relationships in creation order. */
  public List<StoredRelationship> relationships() {
    synchronized (lock) {
      return List.copyOf(relationships);
    }
  }
}
