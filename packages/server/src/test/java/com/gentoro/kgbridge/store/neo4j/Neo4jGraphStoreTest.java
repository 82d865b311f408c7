package com.gentoro.kgbridge.store.neo4j;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.kgbridge.exception.StateException;
import com.gentoro.kgbridge.exception.StoreConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

@ExtendWith(MockitoExtension.class)
class Neo4jGraphStoreTest {

  @Mock Driver driver;
  @Mock Session session;
  @Mock Result result;

  @Test
  void unreachableServerBecomesStoreConnectionException() {
    doThrow(new ServiceUnavailableException("connection refused")).when(driver).verifyConnectivity();
    Neo4jGraphStore store = new Neo4jGraphStore(driver, "bolt://nowhere:7687", "");

    StoreConnectionException ex = assertThrows(StoreConnectionException.class, store::initialize);
    assertEquals("bolt://nowhere:7687", ex.getContext().get("uri"));
    assertFalse(store.isInitialized());
    verify(driver).close();
  }

  @Test
  void initializeProbesAndOpensSessions() {
    when(driver.session(any(SessionConfig.class))).thenReturn(session);
    when(session.run("RETURN 1")).thenReturn(result);
    Neo4jGraphStore store = new Neo4jGraphStore(driver, "bolt://db:7687", "graph");

    store.initialize();

    assertTrue(store.isInitialized());
    assertEquals("bolt://db:7687 (database graph)", store.describeTarget());
    assertNotNull(store.openSession());
    store.shutdown();
    assertFalse(store.isInitialized());
    verify(driver).close();
  }

  @Test
  void openSessionBeforeInitializeFails() {
    assertThrows(
        StateException.class, () -> new Neo4jGraphStore(driver, "bolt://db", null).openSession());
  }
}
