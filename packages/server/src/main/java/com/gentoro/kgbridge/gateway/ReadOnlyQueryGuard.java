package com.gentoro.kgbridge.gateway;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Keyword denylist applied to upper-cased query text. Matching is by plain substring, so a
 * harmless query that merely contains a token (e.g. a property named {@code offset}) is refused as
 * well. Read-access execution remains the primary guarantee; this gate only keeps obvious
 * mutations away from the store.
 */
public class ReadOnlyQueryGuard {

  public static final List<String> DEFAULT_DENYLIST =
      List.of(
          "CREATE", "MERGE", "DELETE", "SET", "DROP", "REMOVE", "CALL DBMS", "LOAD CSV", "FOREACH");

  private final List<String> denylist;

  public ReadOnlyQueryGuard() {
    this(DEFAULT_DENYLIST);
  }

  public ReadOnlyQueryGuard(List<String> denylist) {
    this.denylist =
        denylist.stream()
            .filter(t -> t != null && !t.isBlank())
            .map(t -> t.trim().toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
  }

  public List<String> denylist() {
    return denylist;
  }

  public QueryClassification classify(String query) {
    String upper = query == null ? "" : query.toUpperCase(Locale.ROOT);
    for (String token : denylist) {
      if (upper.contains(token)) {
        return QueryClassification.unsafe(token);
      }
    }
    return QueryClassification.safe();
  }
}
