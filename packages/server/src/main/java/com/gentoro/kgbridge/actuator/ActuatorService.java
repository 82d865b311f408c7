package com.gentoro.kgbridge.actuator;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphStore;
import com.gentoro.kgbridge.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.slf4j.Logger;

/**
 * Health endpoint at {@code /actuator/health}.
 *
 * <p>Response body: {@code {"status":"UP","store":{"driver":"neo4j","status":"UP"}}}. The store
 * part reports {@code DOWN} with the error message when the store cannot be reached; HTTP status is
 * then 503.
 */
public class ActuatorService {
  private static final Logger log = LoggingService.getLogger(ActuatorService.class);

  public static final String PATH = "/actuator/health";

  private final KgBridge kgBridge;

  public ActuatorService(KgBridge kgBridge) {
    this.kgBridge = kgBridge;
  }

  public void register() {
    kgBridge
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet(kgBridge::graphStore)), PATH);
    log.info("Actuator health endpoint registered at {}", PATH);
  }

  /** Health body and whether everything is up. */
  static Map<String, Object> health(Supplier<GraphStore> store) {
    Map<String, Object> storeHealth = new LinkedHashMap<>();
    boolean up;
    try {
      GraphStore s = store.get();
      storeHealth.put("driver", s.getDriverName());
      up = s.isInitialized();
    } catch (RuntimeException e) {
      storeHealth.put("error", e.getMessage());
      up = false;
    }
    storeHealth.put("status", up ? "UP" : "DOWN");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", up ? "UP" : "DOWN");
    body.put("store", storeHealth);
    return body;
  }

  private static class ActuatorServlet extends HttpServlet {
    private final transient Supplier<GraphStore> store;

    ActuatorServlet(Supplier<GraphStore> store) {
      this.store = store;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      Map<String, Object> body = health(store);
      resp.setStatus("UP".equals(body.get("status")) ? 200 : 503);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(body));
      }
    }
  }
}
