package com.gentoro.kgbridge.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgbridge.KgBridgeFixture;
import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.gateway.GraphGatewayTools;
import io.modelcontextprotocol.server.McpServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class GraphToolServerTest {

  private static String text(McpSchema.CallToolResult result) {
    return ((McpSchema.TextContent) result.content().get(0)).text();
  }

  @Test
  void exposesTheFourGraphTools() {
    KgBridgeFixture kg = new KgBridgeFixture();
    GraphToolServer server = new GraphToolServer(kg, new GraphGatewayTools(kg));

    List<SyncToolSpecification> specs = server.toolSpecifications();

    assertEquals(
        List.of("get_graph_schema", "get_graph_stats", "sample_nodes", "query_runner"),
        specs.stream().map(s -> s.tool().name()).collect(Collectors.toList()));
    McpSchema.JsonSchema sampleSchema = specs.get(2).tool().inputSchema();
    assertEquals(List.of("label"), sampleSchema.required());
    assertTrue(sampleSchema.properties().containsKey("limit"));
    assertEquals(List.of("cypher_q"), specs.get(3).tool().inputSchema().required());
  }

  @Test
  void successfulCallReturnsText() {
    McpSchema.CallToolResult result =
        GraphToolServer.invoke("get_graph_stats", args -> "{\"nodeCount\":0}", Map.of());
    assertFalse(result.isError());
    assertEquals("{\"nodeCount\":0}", text(result));
  }

  @Test
  void failingCallBecomesErrorResultWithMessage() {
    McpSchema.CallToolResult result =
        GraphToolServer.invoke(
            "sample_nodes",
            args -> {
              throw new ValidationException("label is required");
            },
            Map.of());
    assertTrue(result.isError());
    assertEquals("label is required", text(result));
  }

  @Test
  void parsesArguments() {
    Map<String, Object> args = Map.of("limit", "7", "n", 3.0, "label", "Person", "bad", "x");
    assertEquals(7, GraphToolServer.intArg(args, "limit"));
    assertEquals(3, GraphToolServer.intArg(args, "n"));
    assertNull(GraphToolServer.intArg(args, "missing"));
    assertEquals("Person", GraphToolServer.stringArg(args, "label"));
    assertThrows(IllegalArgumentException.class, () -> GraphToolServer.intArg(args, "bad"));
  }
}
