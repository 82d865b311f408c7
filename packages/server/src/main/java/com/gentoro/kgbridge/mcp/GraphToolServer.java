package com.gentoro.kgbridge.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ExceptionUtil;
import com.gentoro.kgbridge.gateway.GraphGatewayTools;
import com.gentoro.kgbridge.logging.LoggingService;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.slf4j.Logger;

/**
 * MCP tool server over the SDK's streamable HTTP servlet transport, mounted on the shared Jetty
 * context.
 *
 * <p>Tools:
 *
 * <ul>
 *   <li><b>get_graph_schema</b>: labels, relationship types, property keys and per-label keys
 *   <li><b>get_graph_stats</b>: node and relationship counts
 *   <li><b>sample_nodes</b>(label, limit=5): property maps of a few nodes of one label
 *   <li><b>query_runner</b>(cypher_q): read-only, bounded Cypher
 * </ul>
 *
 * <p>Configuration keys: {@code http.mcp.endpoint} (default {@code /mcp}), {@code
 * http.mcp.disallow-delete}, {@code http.mcp.server.name}, {@code http.mcp.server.version}.
 *
 * <p>A failing handler returns an MCP error result with the underlying message, so the agent can
 * correct its next call.
 */
public class GraphToolServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(GraphToolServer.class);

  public static final String TOOL_SCHEMA = "get_graph_schema";
  public static final String TOOL_STATS = "get_graph_stats";
  public static final String TOOL_SAMPLE = "sample_nodes";
  public static final String TOOL_QUERY = "query_runner";

  private final KgBridge kgBridge;
  private final GraphGatewayTools tools;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public GraphToolServer(KgBridge kgBridge, GraphGatewayTools tools) {
    this.kgBridge = kgBridge;
    this.tools = tools;
  }

  public void register() {
    String endpoint =
        normalizeEndpoint(kgBridge.configuration().getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete =
        kgBridge.configuration().getBoolean("http.mcp.disallow-delete", false);
    String serverName = kgBridge.configuration().getString("http.mcp.server.name", "graph_search");
    String serverVersion = kgBridge.configuration().getString("http.mcp.server.version", "1.0.0");

    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(new JacksonMcpJsonMapper(new ObjectMapper()))
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(toolSpecifications())
            .build();

    kgBridge
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{}",
        kgBridge.httpServer().getPort(),
        endpoint);
  }

  /** The four gateway tools, bound to {@link GraphGatewayTools}. */
  List<SyncToolSpecification> toolSpecifications() {
    return List.of(
        tool(
            TOOL_SCHEMA,
            "Returns graph schema info: node labels, relationship types, and common properties"
                + " (best-effort).",
            Map.of(),
            List.of(),
            args -> tools.graphSchema()),
        tool(
            TOOL_STATS,
            "Returns node/edge counts.",
            Map.of(),
            List.of(),
            args -> tools.graphStats()),
        tool(
            TOOL_SAMPLE,
            "Returns sample nodes for a given label.",
            Map.of(
                "label", Map.of("type", "string"),
                "limit", Map.of("type", "integer", "default", GraphGatewayTools.DEFAULT_SAMPLE_LIMIT)),
            List.of("label"),
            args -> tools.sampleNodes(stringArg(args, "label"), intArg(args, "limit"))),
        tool(
            TOOL_QUERY,
            "Runs READ-ONLY Cypher and returns results.",
            Map.of("cypher_q", Map.of("type", "string")),
            List.of("cypher_q"),
            args -> tools.runQuery(stringArg(args, "cypher_q"))));
  }

  private static SyncToolSpecification tool(
      String name,
      String description,
      Map<String, Object> properties,
      List<String> required,
      Function<Map<String, Object>, String> body) {
    return SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(name)
                .description(description)
                .inputSchema(
                    new McpSchema.JsonSchema(
                        "object",
                        properties,
                        required,
                        false,
                        Collections.emptyMap(),
                        Collections.emptyMap()))
                .build())
        .callHandler(
            (exchange, request) ->
                invoke(name, body, Objects.requireNonNullElse(request.arguments(), Map.of())))
        .build();
  }

  static McpSchema.CallToolResult invoke(
      String name, Function<Map<String, Object>, String> body, Map<String, Object> args) {
    try {
      return McpSchema.CallToolResult.builder()
          .addTextContent(body.apply(args))
          .isError(false)
          .build();
    } catch (Exception e) {
      log.error("Tool '{}' failed", name, e);
      return McpSchema.CallToolResult.builder()
          .addTextContent(
              Objects.requireNonNullElse(
                  e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)))
          .isError(true)
          .build();
    }
  }

  static String stringArg(Map<String, Object> args, String key) {
    Object value = args.get(key);
    return value == null ? null : value.toString();
  }

  static Integer intArg(Map<String, Object> args, String key) {
    Object value = args.get(key);
    if (value == null) return null;
    if (value instanceof Number n) return n.intValue();
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value, e);
    }
  }

  @Override
  public void close() {
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
    mcpServer = null;
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
