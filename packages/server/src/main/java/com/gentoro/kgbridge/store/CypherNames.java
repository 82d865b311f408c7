package com.gentoro.kgbridge.store;

import com.gentoro.kgbridge.exception.ValidationException;

/** Backtick quoting for labels, relationship types and property keys placed into Cypher text. */
public final class CypherNames {
  private CypherNames() {}

  public static String quote(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Cypher identifier must not be blank");
    }
    return "`" + name.replace("`", "``") + "`";
  }

  /** {@code :`A`:`B`} for a label list. */
  public static String labelExpression(Iterable<String> labels) {
    StringBuilder sb = new StringBuilder();
    for (String label : labels) {
      sb.append(':').append(quote(label));
    }
    if (sb.length() == 0) {
      throw new ValidationException("At least one label is required");
    }
    return sb.toString();
  }
}
