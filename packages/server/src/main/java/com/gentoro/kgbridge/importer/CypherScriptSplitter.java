package com.gentoro.kgbridge.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a Cypher script into statements on top-level {@code ;}. Semicolons inside single- or
 * double-quoted strings, backtick identifiers, line comments and block comments do not split.
 * Comments are dropped from the output; blank statements are skipped.
 */
public final class CypherScriptSplitter {
  private CypherScriptSplitter() {}

  public static List<String> split(String script) {
    List<String> statements = new ArrayList<>();
    if (script == null || script.isEmpty()) return statements;

    StringBuilder current = new StringBuilder();
    int n = script.length();
    int i = 0;
    while (i < n) {
      char c = script.charAt(i);
      char next = i + 1 < n ? script.charAt(i + 1) : '\0';

      if (c == '\'' || c == '"' || c == '`') {
        int end = skipQuoted(script, i, c);
        current.append(script, i, end);
        i = end;
      } else if (c == '/' && next == '/') {
        int end = script.indexOf('\n', i);
        i = end < 0 ? n : end;
      } else if (c == '/' && next == '*') {
        int end = script.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
        current.append(' ');
      } else if (c == ';') {
        add(statements, current);
        i++;
      } else {
        current.append(c);
        i++;
      }
    }
    add(statements, current);
    return statements;
  }

  /** Index just past the closing quote; backslash escapes apply inside strings, not backticks. */
  private static int skipQuoted(String s, int start, char quote) {
    int i = start + 1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\\' && quote != '`') {
        i += 2;
        continue;
      }
      if (c == quote) {
        // doubled backtick is an escaped backtick
        if (quote == '`' && i + 1 < s.length() && s.charAt(i + 1) == '`') {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return s.length();
  }

  private static void add(List<String> statements, StringBuilder current) {
    String stmt = current.toString().trim();
    if (!stmt.isEmpty()) statements.add(stmt);
    current.setLength(0);
  }
}
