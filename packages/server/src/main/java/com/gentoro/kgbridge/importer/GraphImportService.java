package com.gentoro.kgbridge.importer;

import com.gentoro.kgbridge.KgBridge;
import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.export.ExportDocument;
import com.gentoro.kgbridge.export.PropertyGraphExport;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.GraphStore;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * One import run against a graph store: a single session, optional wipe, structured or script
 * mode, optional marker removal, and store statistics before and after.
 */
public class GraphImportService {
  private static final Logger log = LoggingService.getLogger(GraphImportService.class);

  /** What the caller asked for. */
  public record Options(boolean clear, boolean useScript) {}

  /** Everything an import run produced. */
  public record Report(
      GraphStats before, ImportOutcome outcome, long markersRemoved, GraphStats after) {}

  private final GraphStore store;
  private final PropertyGraphWriter writer;
  private final CypherScriptExecutor scriptExecutor;
  private final String markerKey;
  private final boolean removeMarker;

  public GraphImportService(KgBridge kgBridge) {
    this(
        kgBridge.graphStore(),
        new PropertyGraphWriter(kgBridge.identityProperty(), kgBridge.storeValues()),
        new CypherScriptExecutor(),
        kgBridge.identityProperty(),
        kgBridge.configuration().getBoolean("import.identity.remove-after-import", false));
  }

  public GraphImportService(
      GraphStore store,
      PropertyGraphWriter writer,
      CypherScriptExecutor scriptExecutor,
      String markerKey,
      boolean removeMarker) {
    this.store = store;
    this.writer = writer;
    this.scriptExecutor = scriptExecutor;
    this.markerKey = markerKey;
    this.removeMarker = removeMarker;
  }

  public Report run(ExportDocument document, Options options, ImportListener listener) {
    Optional<String> script = document.cypherScript();
    Optional<PropertyGraphExport> graph = document.propertyGraph();
    boolean scriptMode = options.useScript();
    if (scriptMode && script.isEmpty()) {
      throw new ValidationException("No cypherScript found in export");
    }
    if (!scriptMode && graph.isEmpty()) {
      if (script.isEmpty()) {
        throw new ValidationException("Export has no nodes, relationships or cypherScript");
      }
      log.info("Export carries only a Cypher script; executing it");
      scriptMode = true;
    }

    try (GraphSession session = store.openSession()) {
      GraphStats before = GraphStats.collect(session);
      log.info(
          "Store before import: {} nodes, {} relationships",
          before.nodeCount(),
          before.relationshipCount());
      listener.beforeImport(before);

      if (options.clear()) {
        long deleted = session.clearAll();
        log.info("Cleared store ({} nodes deleted)", deleted);
        listener.notice("🗑️  Cleared all existing data from the store (" + deleted + " nodes)");
      }

      ImportOutcome outcome =
          scriptMode
              ? scriptExecutor.execute(script.get(), session, listener)
              : writer.write(graph.get(), session, listener);

      long removed = 0;
      if (removeMarker && !scriptMode) {
        removed = session.removeProperty(markerKey);
        log.info("Removed identity marker '{}' from {} nodes", markerKey, removed);
      }

      GraphStats after = GraphStats.collect(session);
      log.info(
          "Store after import: {} nodes, {} relationships",
          after.nodeCount(),
          after.relationshipCount());
      listener.afterImport(after);
      return new Report(before, outcome, removed, after);
    }
  }
}
