package com.gentoro.kgbridge.importer;

import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.utility.StringUtility;
import java.util.List;
import org.slf4j.Logger;

/**
 * Runs a ready-made Cypher script statement by statement. Each statement is independent: a
 * failure is recorded and the next statement still runs.
 */
public class CypherScriptExecutor {
  private static final Logger log = LoggingService.getLogger(CypherScriptExecutor.class);

  public static final String PHASE_STATEMENTS = "statements";
  private static final int PREVIEW_LENGTH = 50;

  public ImportOutcome execute(String script, GraphSession session, ImportListener listener) {
    ImportOutcome outcome = new ImportOutcome();
    List<String> statements = CypherScriptSplitter.split(script);
    log.info(
        "Executing Cypher script ({} characters, {} statements)",
        script.length(),
        statements.size());

    listener.beginPhase(PHASE_STATEMENTS, statements.size());
    int ordinal = 0;
    for (String statement : statements) {
      ordinal++;
      outcome.statementAttempted();
      String preview = StringUtility.abbreviate(statement, PREVIEW_LENGTH);
      try {
        session.execute(statement);
        outcome.statementExecuted();
        listener.entityWritten(PHASE_STATEMENTS, preview);
      } catch (RuntimeException e) {
        EntityFailure failure =
            new EntityFailure(
                EntityFailure.Kind.STATEMENT,
                "#" + ordinal,
                preview,
                PropertyGraphWriter.reason(e));
        log.warn("Statement #{} failed ({}): {}", ordinal, preview, failure.reason());
        outcome.recordFailure(failure);
        listener.entityFailed(PHASE_STATEMENTS, failure);
      }
    }
    listener.endPhase(
        PHASE_STATEMENTS, outcome.getStatementsExecuted(), outcome.getStatementsAttempted());
    return outcome;
  }
}
