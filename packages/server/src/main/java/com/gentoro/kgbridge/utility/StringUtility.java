package com.gentoro.kgbridge.utility;

import java.util.Collection;
import java.util.stream.Collectors;

public class StringUtility {

  /** Collapse whitespace and cut {@code input} to {@code max} characters, appending "...". */
  public static String abbreviate(String input, int max) {
    if (input == null) return "";
    String flat = input.replaceAll("\\s+", " ").trim();
    if (max < 4 || flat.length() <= max) return flat;
    return flat.substring(0, max - 3) + "...";
  }

  public static String joinOrNone(Collection<?> values) {
    if (values == null || values.isEmpty()) return "none";
    return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }
}
