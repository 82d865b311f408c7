package com.gentoro.kgbridge.store.spi;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.store.GraphStore;

/**
 * Service provider for {@link GraphStore} implementations, discovered through {@link
 * java.util.ServiceLoader} ({@code META-INF/services}).
 */
public interface GraphStoreProvider {

  /** Value of {@code graph.store.driver} that selects this provider. */
  String id();

  /** @return true when the provider can be used with the current configuration. */
  boolean isAvailable(KgBridge kgBridge);

  /** Create an unconnected store; the caller runs {@link GraphStore#initialize()}. */
  GraphStore create(KgBridge kgBridge);
}
