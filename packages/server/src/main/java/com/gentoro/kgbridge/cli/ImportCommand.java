package com.gentoro.kgbridge.cli;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ConfigException;
import com.gentoro.kgbridge.exception.IoException;
import com.gentoro.kgbridge.exception.MalformedExportException;
import com.gentoro.kgbridge.exception.StoreConnectionException;
import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.export.ExportDocument;
import com.gentoro.kgbridge.export.ExportDocumentParser;
import com.gentoro.kgbridge.importer.ConsoleImportListener;
import com.gentoro.kgbridge.importer.GraphImportService;
import com.gentoro.kgbridge.importer.ImportOutcome;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphStore;
import com.gentoro.kgbridge.utility.StdoutUtility;
import java.io.PrintStream;
import java.nio.file.Path;
import org.slf4j.Logger;

/**
 * {@code kgbridge export.json [--clear] [--use-script]}: parse, connect, import, report. The export
 * is parsed before the store is touched, so a malformed file never mutates anything.
 */
public class ImportCommand {
  private static final Logger log = LoggingService.getLogger(ImportCommand.class);

  private final KgBridge kgBridge;
  private final PrintStream out;
  private final ExportDocumentParser parser;

  public ImportCommand(KgBridge kgBridge, PrintStream out) {
    this(kgBridge, out, new ExportDocumentParser());
  }

  public ImportCommand(KgBridge kgBridge, PrintStream out, ExportDocumentParser parser) {
    this.kgBridge = kgBridge;
    this.out = out;
    this.parser = parser;
  }

  public int run(Path exportFile, GraphImportService.Options options) {
    StdoutUtility.printRule(out);
    out.println("🔷 Export → Graph Store Loader");
    StdoutUtility.printRule(out);

    ExportDocument document;
    try {
      document = parser.parse(exportFile);
    } catch (MalformedExportException | IoException e) {
      StdoutUtility.printError(out, "Cannot load " + exportFile + ": " + e.getMessage(), null);
      log.debug("Export rejected", e);
      return ExitCodes.INVALID_INPUT;
    }
    document
        .propertyGraph()
        .ifPresent(
            g ->
                out.println(
                    "\n📊 Export contains: "
                        + g.nodes().size()
                        + " nodes, "
                        + g.relationships().size()
                        + " relationships"));

    GraphStore store;
    try {
      store = kgBridge.graphStore();
    } catch (StoreConnectionException | ConfigException e) {
      StdoutUtility.printError(out, "Failed to connect to the graph store: " + e.getMessage(), null);
      out.println();
      out.println(CliText.TROUBLESHOOTING);
      log.debug("Store connection failed", e);
      return ExitCodes.STORE_UNAVAILABLE;
    }
    out.println("✅ Connected to " + store.getDriverName() + " at " + store.describeTarget());

    GraphImportService.Report report;
    try {
      report =
          new GraphImportService(kgBridge).run(document, options, new ConsoleImportListener(out));
    } catch (ValidationException e) {
      StdoutUtility.printError(out, e.getMessage(), null);
      return ExitCodes.INVALID_INPUT;
    }

    ImportOutcome outcome = report.outcome();
    out.println();
    StdoutUtility.printRule(out);
    out.println(outcome.hasFailures() ? "⚠️  Loading finished with failures" : "✅ Loading Complete!");
    StdoutUtility.printRule(out);
    if (outcome.getStatementsAttempted() > 0) {
      out.println(
          "   Statements executed: "
              + outcome.getStatementsExecuted()
              + "/"
              + outcome.getStatementsAttempted());
    } else {
      out.println(
          "   Nodes created: " + outcome.getNodesCreated() + "/" + outcome.getNodesAttempted());
      out.println(
          "   Relationships created: "
              + outcome.getRelationshipsCreated()
              + "/"
              + outcome.getRelationshipsAttempted());
    }
    if (report.markersRemoved() > 0) {
      out.println("   Identity marker removed from " + report.markersRemoved() + " nodes");
    }
    if ("neo4j".equals(store.getDriverName())) {
      out.println("\n🌐 Open Neo4j Browser: http://localhost:7474");
      out.println("   Try: MATCH (n) RETURN n");
    }
    return ExitCodes.OK;
  }
}
