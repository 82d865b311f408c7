package com.gentoro.kgbridge.store.providers;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.store.GraphStore;
import com.gentoro.kgbridge.store.neo4j.Neo4jGraphStore;
import com.gentoro.kgbridge.store.spi.GraphStoreProvider;

/** Service provider for the Bolt-connected Neo4j store. */
public class Neo4jGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "neo4j";
  }

  @Override
  public boolean isAvailable(KgBridge kgBridge) {
    String uri = kgBridge.configuration().getString("graph.store.neo4j.uri", null);
    return uri != null && !uri.isBlank();
  }

  @Override
  public GraphStore create(KgBridge kgBridge) {
    return new Neo4jGraphStore(kgBridge);
  }
}
