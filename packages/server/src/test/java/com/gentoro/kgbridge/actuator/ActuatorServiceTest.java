package com.gentoro.kgbridge.actuator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgbridge.exception.StoreConnectionException;
import com.gentoro.kgbridge.store.memory.InMemoryGraphStore;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ActuatorServiceTest {

  @Test
  @SuppressWarnings("unchecked")
  void upWhenStoreIsConnected() {
    InMemoryGraphStore store = new InMemoryGraphStore();
    store.initialize();

    Map<String, Object> body = ActuatorService.health(() -> store);

    assertEquals("UP", body.get("status"));
    Map<String, Object> storePart = (Map<String, Object>) body.get("store");
    assertEquals("in-memory", storePart.get("driver"));
    assertEquals("UP", storePart.get("status"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void downWithErrorWhenStoreIsUnreachable() {
    Map<String, Object> body =
        ActuatorService.health(
            () -> {
              throw new StoreConnectionException(
                  "Cannot reach Neo4j at bolt://x", new IllegalStateException("refused"));
            });

    assertEquals("DOWN", body.get("status"));
    Map<String, Object> storePart = (Map<String, Object>) body.get("store");
    assertEquals("Cannot reach Neo4j at bolt://x", storePart.get("error"));
    assertEquals("DOWN", storePart.get("status"));
  }
}
