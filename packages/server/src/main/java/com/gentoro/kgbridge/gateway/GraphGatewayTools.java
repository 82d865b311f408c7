package com.gentoro.kgbridge.gateway;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.GraphStore;
import com.gentoro.kgbridge.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Tool operations offered to an agent. Stateless: each call opens its own session and closes it
 * before returning. Results are text the agent can read directly.
 */
public class GraphGatewayTools {
  public static final int DEFAULT_SAMPLE_LIMIT = 5;

  private final Supplier<GraphStore> store;
  private final SchemaIntrospector introspector;
  private final QuerySafetyGateway gateway;
  private final int sampleMaxLimit;

  public GraphGatewayTools(KgBridge kgBridge) {
    this(
        kgBridge::graphStore,
        introspector(kgBridge.configuration()),
        gateway(kgBridge.configuration()),
        kgBridge.configuration().getInt("gateway.sample.max-limit", 100));
  }

  public GraphGatewayTools(
      Supplier<GraphStore> store,
      SchemaIntrospector introspector,
      QuerySafetyGateway gateway,
      int sampleMaxLimit) {
    this.store = store;
    this.introspector = introspector;
    this.gateway = gateway;
    this.sampleMaxLimit = Math.max(1, sampleMaxLimit);
  }

  private static SchemaIntrospector introspector(Configuration cfg) {
    return new SchemaIntrospector(
        cfg.getInt("gateway.schema.max-labels", 30),
        cfg.getInt("gateway.schema.sample-size", 50),
        cfg.getInt("gateway.schema.max-keys", 20));
  }

  private static QuerySafetyGateway gateway(Configuration cfg) {
    List<String> denylist = cfg.getList(String.class, "gateway.query.denylist", null);
    ReadOnlyQueryGuard guard =
        denylist == null || denylist.isEmpty()
            ? new ReadOnlyQueryGuard()
            : new ReadOnlyQueryGuard(denylist);
    return new QuerySafetyGateway(guard, cfg.getInt("gateway.query.default-limit", 25));
  }

  /** Pretty JSON of the current {@link SchemaSummary}. */
  public String graphSchema() {
    try (GraphSession session = store.get().openSession()) {
      return JacksonUtility.toJson(introspector.introspect(session));
    }
  }

  public String graphStats() {
    try (GraphSession session = store.get().openSession()) {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("nodeCount", session.countNodes());
      out.put("edgeCount", session.countRelationships());
      return JacksonUtility.toJson(out);
    }
  }

  /**
   * Pretty JSON array of up to {@code limit} property maps of nodes carrying {@code label}. The
   * label must be one the store currently has.
   */
  public String sampleNodes(String label, Integer limit) {
    if (label == null || label.isBlank()) {
      throw new ValidationException("label is required");
    }
    int bounded = limit == null ? DEFAULT_SAMPLE_LIMIT : Math.max(1, Math.min(limit, sampleMaxLimit));
    try (GraphSession session = store.get().openSession()) {
      if (!session.labels().contains(label)) {
        return "Unknown label: " + label;
      }
      return JacksonUtility.toJson(session.sampleNodes(label, bounded));
    }
  }

  public String runQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new ValidationException("query is required");
    }
    try (GraphSession session = store.get().openSession()) {
      return gateway.run(query, session);
    }
  }
}
