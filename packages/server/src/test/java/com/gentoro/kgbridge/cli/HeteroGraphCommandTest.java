package com.gentoro.kgbridge.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HeteroGraphCommandTest {

  @TempDir Path dir;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final HeteroGraphCommand command =
      new HeteroGraphCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8));

  @Test
  void propertyGraphOnlyExportHasNoTensorPart() throws Exception {
    Path file = dir.resolve("graph.json");
    Files.writeString(file, "{\"nodes\":[{\"id\":1}]}");

    assertEquals(ExitCodes.INVALID_INPUT, command.run(file));
    assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("no tensor part"));
  }

  @Test
  void printsSummaryWithLabels() throws Exception {
    Path file = dir.resolve("tensor.json");
    Files.writeString(
        file,
        "{\"nodeFeatures\":{\"user\":[[1],[2]]},\"nodeLabels\":{\"user\":[\"u1\",\"u2\"]},"
            + "\"edgeIndices\":{}}");

    assertEquals(ExitCodes.OK, command.run(file));
    String out = buffer.toString(StandardCharsets.UTF_8);
    assertTrue(out.contains("  - user: 2 nodes, 1 features"));
    assertTrue(out.contains("    Labels: [u1, u2]"));
  }
}
