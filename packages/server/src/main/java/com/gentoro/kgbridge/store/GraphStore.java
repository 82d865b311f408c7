package com.gentoro.kgbridge.store;

/**
 * Handle on a property-graph store. The store object is shared and thread-safe; all work happens
 * in {@link GraphSession}s opened per import run or per gateway call.
 */
public interface GraphStore extends AutoCloseable {

  /**
   * Connect and verify the store is reachable with the configured credentials.
   *
   * @throws com.gentoro.kgbridge.exception.StoreConnectionException when it is not
   */
  void initialize();

  /** @return true once {@link #initialize()} succeeded and before {@link #shutdown()}. */
  boolean isInitialized();

  GraphSession openSession();

  /** @return provider id, e.g. {@code neo4j} or {@code in-memory}. */
  String getDriverName();

  /** @return human readable target, e.g. the Bolt URI. */
  String describeTarget();

  /** Clean up resources. Equivalent to {@link #shutdown()}. */
  @Override
  default void close() {
    shutdown();
  }

  void shutdown();
}
