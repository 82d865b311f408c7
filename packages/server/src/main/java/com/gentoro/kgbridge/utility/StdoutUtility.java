package com.gentoro.kgbridge.utility;

import com.gentoro.kgbridge.exception.ExceptionUtil;
import java.io.PrintStream;

public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  public static void printSuccessLine(PrintStream out, String message) {
    for (String line : message.split("\n")) {
      out.printf("  ✓ %s%s%s%n", green, line, reset);
    }
  }

  public static void printFailureLine(PrintStream out, String message) {
    for (String line : message.split("\n")) {
      out.printf("  ✗ %s%s%s%n", red, line, reset);
    }
  }

  public static void printRule(PrintStream out) {
    out.println("=".repeat(60));
  }

  public static void printError(PrintStream out, String message, Throwable cause) {
    out.printf("❌ %s%s%s%n", red, message, reset);
    if (cause != null) {
      for (String line : ExceptionUtil.formatCompactStackTrace(cause, 3).split("\n")) {
        out.printf("  %s%s%s%n", red, line, reset);
      }
    }
  }
}
