package com.gentoro.kgbridge.store;

import java.util.List;
import java.util.Map;

/**
 * One unit of work against a graph store. Opened by {@link GraphStore#openSession()} and closed in
 * try-with-resources on every exit path; not shared across threads.
 *
 * <p>Property maps passed in hold plain values already prepared by {@link StoreValues}. Structural
 * names (labels, relationship types, property keys) are quoted by the implementation, never
 * spliced unchecked.
 */
public interface GraphSession extends AutoCloseable {

  // ---- writes ----

  /** Create one node carrying the given labels and properties. */
  void createNode(List<String> labels, Map<String, Object> properties);

  /**
   * Create a relationship between the nodes whose {@code identityKey} property equals {@code
   * startId} and {@code endId}.
   *
   * @return number of relationships created; zero when either endpoint is not found
   */
  long createRelationship(
      String identityKey, Object startId, Object endId, String type, Map<String, Object> properties);

  /** Run one raw statement in its own auto-commit unit. */
  void execute(String statement);

  /** Delete every node and relationship. @return number of nodes deleted */
  long clearAll();

  /** Remove a property from every node carrying it. @return number of nodes touched */
  long removeProperty(String key);

  // ---- schema and stats ----

  List<String> labels();

  List<String> relationshipTypes();

  List<String> propertyKeys();

  /**
   * Most frequent property keys of a label, counted over its first {@code sampleSize} nodes,
   * frequency descending.
   */
  List<String> frequentPropertyKeys(String label, int sampleSize, int limit);

  long countNodes();

  long countRelationships();

  // ---- reads ----

  /** Property maps of up to {@code limit} nodes carrying {@code label}. */
  List<Map<String, Object>> sampleNodes(String label, int limit);

  /**
   * Run caller-supplied query text in a read-only transaction. Rows come back as plain maps
   * (nested graph entities flattened to their properties).
   */
  List<Map<String, Object>> runReadQuery(String query);

  @Override
  void close();
}
