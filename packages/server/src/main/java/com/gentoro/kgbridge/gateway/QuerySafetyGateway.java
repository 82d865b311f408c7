package com.gentoro.kgbridge.gateway;

import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.utility.JacksonUtility;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Runs agent-supplied Cypher after two gates: the {@link ReadOnlyQueryGuard} refusal and a row
 * bound appended when the text carries no {@code LIMIT}. Accepted text runs in a read-only
 * transaction. Store errors propagate to the caller.
 */
public class QuerySafetyGateway {
  private static final Logger log = LoggingService.getLogger(QuerySafetyGateway.class);

  public static final String REFUSAL = "Refused: only read-only Cypher is allowed.";
  public static final String NO_RESULTS = "No results found.";

  private final ReadOnlyQueryGuard guard;
  private final int defaultLimit;

  public QuerySafetyGateway(ReadOnlyQueryGuard guard, int defaultLimit) {
    this.guard = guard;
    this.defaultLimit = defaultLimit;
  }

  public String run(String query, GraphSession session) {
    QueryClassification classification = guard.classify(query);
    if (!classification.isSafe()) {
      log.warn("Refused query containing '{}'", classification.matchedToken());
      return REFUSAL;
    }
    String bounded = bound(query);
    List<Map<String, Object>> rows = session.runReadQuery(bounded);
    log.debug("Query returned {} rows", rows.size());
    if (rows.isEmpty()) return NO_RESULTS;
    return rows.stream().map(JacksonUtility::toCompactJson).collect(Collectors.joining("\n"));
  }

  /** Append {@code LIMIT n} unless the text already mentions a limit. Trailing semicolons go. */
  public String bound(String query) {
    if (query.toUpperCase(Locale.ROOT).contains("LIMIT")) return query;
    String text = query.stripTrailing();
    while (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1).stripTrailing();
    }
    return text + "\nLIMIT " + defaultLimit;
  }
}
