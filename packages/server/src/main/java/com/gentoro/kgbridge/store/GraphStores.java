package com.gentoro.kgbridge.store;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ConfigException;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.spi.GraphStoreProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.slf4j.Logger;

/** Resolves the configured {@link GraphStore} through the provider SPI. */
public final class GraphStores {
  private static final Logger log = LoggingService.getLogger(GraphStores.class);

  private GraphStores() {}

  public static GraphStore resolve(KgBridge kgBridge) {
    String desired = kgBridge.configuration().getString("graph.store.driver", "neo4j");
    log.trace("Resolving graph store driver '{}'", desired);

    List<String> known = new ArrayList<>();
    for (GraphStoreProvider p : ServiceLoader.load(GraphStoreProvider.class)) {
      known.add(p.id());
      if (!p.id().equalsIgnoreCase(desired)) continue;
      if (!p.isAvailable(kgBridge)) {
        throw new ConfigException(
            "Graph store driver '" + desired + "' is not usable with the current configuration");
      }
      return p.create(kgBridge);
    }
    throw new ConfigException(
        "Unknown graph store driver '" + desired + "'; available: " + String.join(", ", known));
  }
}
