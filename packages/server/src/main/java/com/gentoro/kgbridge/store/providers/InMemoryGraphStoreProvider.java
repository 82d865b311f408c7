package com.gentoro.kgbridge.store.providers;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.store.GraphStore;
import com.gentoro.kgbridge.store.memory.InMemoryGraphStore;
import com.gentoro.kgbridge.store.spi.GraphStoreProvider;

/** Service provider for the process-local store. Always available. */
public class InMemoryGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public boolean isAvailable(KgBridge kgBridge) {
    return true;
  }

  @Override
  public GraphStore create(KgBridge kgBridge) {
    return new InMemoryGraphStore();
  }
}
