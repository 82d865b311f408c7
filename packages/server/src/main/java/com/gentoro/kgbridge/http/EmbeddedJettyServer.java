package com.gentoro.kgbridge.http;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ConfigException;
import com.gentoro.kgbridge.exception.ExceptionUtil;
import com.gentoro.kgbridge.exception.NetworkException;
import com.gentoro.kgbridge.logging.LoggingService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;

/**
 * Embedded Jetty 12 server with one root {@link ServletContextHandler}. Components mount their
 * servlets on {@link #getContextHandler()} between {@link #prepare()} and {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);

  private static final String BIND_HINT =
      "Check that the configured http.port and http.hostname are free and that this process may"
          + " open a listener on them";

  private final KgBridge kgBridge;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(KgBridge kgBridge) {
    this.kgBridge = kgBridge;
  }

  /** Build the Jetty server and root context without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      String hostname;
      try {
        port = kgBridge.configuration().getInt("http.port", 8080);
        hostname = kgBridge.configuration().getString("http.hostname", "0.0.0.0");
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port / http.hostname configuration", e);
      }
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();
      log.trace("Preparing Jetty on {}:{}", hostname, port);

      try {
        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize Jetty. " + BIND_HINT, e);
      }
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, ex -> new NetworkException("Failed to start Jetty. " + BIND_HINT, ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping Jetty; continuing shutdown", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return kgBridge.configuration().getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
