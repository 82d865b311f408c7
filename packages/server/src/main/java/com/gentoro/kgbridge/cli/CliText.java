package com.gentoro.kgbridge.cli;

import com.gentoro.kgbridge.exception.IoException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Usage line, quick start guide and sample queries shown by the command line. */
public final class CliText {
  private CliText() {}

  public static final String USAGE =
      String.join(
          "\n",
          "Usage: kgbridge [export.json] [--mode import|hetero|server] [--config-file LOCATION]",
          "                [--uri bolt://host:7687] [--user neo4j] [--password secret]"
              + " [--database name]",
          "                [--clear] [--use-script] [--guide] [--queries]",
          "",
          "Modes:",
          "  import   load a property-graph export into the graph store (default)",
          "  hetero   assemble a tensor export into a heterogeneous graph and print its summary",
          "  server   serve the read-only graph tools over MCP",
          "",
          "Examples:",
          "  kgbridge graph.json --password mypassword",
          "  kgbridge graph.json --clear --uri bolt://localhost:7687",
          "  kgbridge graph_tensor.json --mode hetero",
          "  kgbridge --guide");

  public static final String TROUBLESHOOTING =
      String.join(
          "\n",
          "Troubleshooting:",
          "  1. Is Neo4j running? (check Neo4j Desktop or the service)",
          "  2. Is the bolt port correct? (default: 7687)",
          "  3. Are the credentials correct?");

  public static String guide() {
    return resource("cli/guide.txt");
  }

  public static String sampleQueries() {
    return resource("cli/queries.txt");
  }

  private static String resource(String name) {
    try (InputStream in = CliText.class.getClassLoader().getResourceAsStream(name)) {
      if (in == null) {
        throw new IoException("Missing classpath resource: " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read classpath resource: " + name, e);
    }
  }
}
