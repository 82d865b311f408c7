package com.gentoro.kgbridge.store.neo4j;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ConfigException;
import com.gentoro.kgbridge.exception.StateException;
import com.gentoro.kgbridge.exception.StoreConnectionException;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.GraphStore;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;

/**
 * Neo4j store reached over Bolt with the official Java driver. The {@link Driver} is the only
 * shared handle; every {@link GraphSession} wraps its own driver session.
 */
public class Neo4jGraphStore implements GraphStore {
  private static final Logger log = LoggingService.getLogger(Neo4jGraphStore.class);

  private final String uri;
  private final String user;
  private final String password;
  private final String database;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private Driver driver;

  public Neo4jGraphStore(KgBridge kgBridge) {
    Objects.requireNonNull(kgBridge, "kgBridge");
    this.uri = kgBridge.configuration().getString("graph.store.neo4j.uri", "bolt://localhost:7687");
    this.user = kgBridge.configuration().getString("graph.store.neo4j.user", "neo4j");
    this.password = kgBridge.configuration().getString("graph.store.neo4j.password", "");
    this.database = kgBridge.configuration().getString("graph.store.neo4j.database", "");
  }

  /** Wrap an already built driver. */
  public Neo4jGraphStore(Driver driver, String uri, String database) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.uri = uri;
    this.user = null;
    this.password = null;
    this.database = database == null ? "" : database;
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;
    log.trace("Initializing Neo4j store at {}", uri);
    if (driver == null) {
      try {
        driver = GraphDatabase.driver(uri, AuthTokens.basic(user, password));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid Neo4j URI: " + uri, e);
      }
    }
    try {
      driver.verifyConnectivity();
      try (Session session = driver.session(sessionConfig())) {
        session.run("RETURN 1").consume();
      }
    } catch (Neo4jException e) {
      closeDriver();
      throw new StoreConnectionException(
          "Cannot reach Neo4j at " + uri + ": " + e.getMessage(),
          Map.of("uri", String.valueOf(uri), "database", database),
          e);
    }
    initialized.set(true);
    log.debug("Neo4j store at {} is reachable", uri);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public GraphSession openSession() {
    if (!initialized.get()) {
      throw new StateException("Neo4j store not initialized. Call initialize() first.");
    }
    return new Neo4jGraphSession(driver.session(sessionConfig()));
  }

  private SessionConfig sessionConfig() {
    return database.isBlank() ? SessionConfig.defaultConfig() : SessionConfig.forDatabase(database);
  }

  @Override
  public String getDriverName() {
    return "neo4j";
  }

  @Override
  public String describeTarget() {
    return database.isBlank() ? uri : uri + " (database " + database + ")";
  }

  @Override
  public void shutdown() {
    initialized.set(false);
    closeDriver();
  }

  private void closeDriver() {
    if (driver != null) {
      try {
        driver.close();
      } catch (RuntimeException e) {
        log.warn("Error closing Neo4j driver: {}", e.getMessage());
      } finally {
        driver = null;
      }
    }
  }
}
