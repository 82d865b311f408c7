package com.gentoro.kgbridge;

import com.gentoro.kgbridge.actuator.ActuatorService;
import com.gentoro.kgbridge.exception.ExceptionUtil;
import com.gentoro.kgbridge.exception.NetworkException;
import com.gentoro.kgbridge.exception.StateException;
import com.gentoro.kgbridge.gateway.GraphGatewayTools;
import com.gentoro.kgbridge.http.EmbeddedJettyServer;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.mcp.GraphToolServer;
import com.gentoro.kgbridge.store.GraphStore;
import com.gentoro.kgbridge.store.GraphStores;
import com.gentoro.kgbridge.store.StoreValues;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: startup parameters, configuration and the shared graph store handle.
 *
 * <p>Components receive this context explicitly; there is no process-wide singleton. The graph
 * store is resolved and connected on first use so that commands which never touch the store
 * (hetero assembly, help) do not need a reachable database.
 */
public class KgBridge {

  private static final org.slf4j.Logger log = LoggingService.getLogger(KgBridge.class);

  /** Command-line options that map onto configuration keys. */
  static final Map<String, String> CLI_OVERRIDES =
      Map.of(
          "uri", "graph.store.neo4j.uri",
          "user", "graph.store.neo4j.user",
          "password", "graph.store.neo4j.password",
          "database", "graph.store.neo4j.database");

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private GraphStore graphStore;
  private EmbeddedJettyServer httpServer;
  private GraphToolServer toolServer;
  private final Object storeLock = new Object();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public KgBridge(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs));
  }

  public KgBridge(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  public void initialize() {
    // Silence java.util.logging; the Neo4j driver and Jetty log through SLF4J.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if (configurationProvider == null) {
      this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    }
    applyCommandLineOverrides();
    LoggingService.applyConfiguration(configuration());
    log.debug("kgbridge initialized in mode '{}'", startupParameters.mode());
  }

  private void applyCommandLineOverrides() {
    Map<String, Object> overrides = new LinkedHashMap<>();
    CLI_OVERRIDES.forEach(
        (option, key) ->
            startupParameters
                .getOptionalParameter(option, String.class)
                .ifPresent(v -> overrides.put(key, v)));
    if (!overrides.isEmpty()) {
      configure(overrides);
    }
  }

  /** Set configuration keys at runtime; used for command-line overrides. */
  protected void configure(Map<String, ?> overrides) {
    configurationProvider.applyOverrides(overrides);
  }

  /**
   * The shared graph store, resolved through the provider SPI and connected on first call.
   *
   * @throws com.gentoro.kgbridge.exception.StoreConnectionException when it cannot connect
   */
  public GraphStore graphStore() {
    synchronized (storeLock) {
      if (graphStore == null) {
        GraphStore store = GraphStores.resolve(this);
        store.initialize();
        graphStore = store;
        log.info("Connected to {} store at {}", store.getDriverName(), store.describeTarget());
      }
      return graphStore;
    }
  }

  public StoreValues storeValues() {
    return new StoreValues(configuration().getBoolean("import.properties.coerce-objects", true));
  }

  public String identityProperty() {
    return configuration().getString("import.identity.property", "_export_id");
  }

  /** Start Jetty with the health endpoint and the MCP tool server mounted. */
  public void startServer() {
    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      this.toolServer = new GraphToolServer(this, new GraphGatewayTools(this));
      toolServer.register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new NetworkException("Could not start http server", ex));
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "kgbridge-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(toolServer);
        closeQuietly(httpServer);
        synchronized (storeLock) {
          closeQuietly(graphStore);
          graphStore = null;
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while releasing {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("KgBridge not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
