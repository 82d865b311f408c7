package com.gentoro.kgbridge.importer;

import com.gentoro.kgbridge.utility.StdoutUtility;
import com.gentoro.kgbridge.utility.StringUtility;
import java.io.PrintStream;
import java.util.Objects;

/** Prints one ✓/✗ line per entity and a count per phase. */
public class ConsoleImportListener implements ImportListener {
  private final PrintStream out;

  public ConsoleImportListener(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void beginPhase(String phase, long total) {
    out.println();
    switch (phase) {
      case PropertyGraphWriter.PHASE_NODES -> out.println("📦 Creating " + total + " nodes...");
      case PropertyGraphWriter.PHASE_RELATIONSHIPS ->
          out.println("🔗 Creating " + total + " relationships...");
      default -> out.println("📜 Executing " + total + " statements...");
    }
  }

  @Override
  public void entityWritten(String phase, String description) {
    StdoutUtility.printSuccessLine(out, "Created " + description);
  }

  @Override
  public void entityFailed(String phase, EntityFailure failure) {
    StdoutUtility.printFailureLine(
        out, "Failed " + failure.identifier() + " [" + failure.type() + "]: " + failure.reason());
  }

  @Override
  public void endPhase(String phase, long succeeded, long attempted) {
    out.println("  " + succeeded + "/" + attempted + " " + phase + " done");
  }

  @Override
  public void notice(String message) {
    out.println(message);
  }

  @Override
  public void beforeImport(GraphStats stats) {
    out.println();
    out.println(
        "📊 Current store: "
            + stats.nodeCount()
            + " nodes, "
            + stats.relationshipCount()
            + " relationships");
    if (!stats.labels().isEmpty()) {
      out.println("   Labels: " + StringUtility.joinOrNone(stats.labels()));
    }
  }

  @Override
  public void afterImport(GraphStats stats) {
    out.println();
    out.println("📊 Final store stats:");
    out.println("   Nodes: " + stats.nodeCount());
    out.println("   Relationships: " + stats.relationshipCount());
    out.println("   Labels: " + StringUtility.joinOrNone(stats.labels()));
    out.println("   Relationship Types: " + StringUtility.joinOrNone(stats.relationshipTypes()));
  }
}
