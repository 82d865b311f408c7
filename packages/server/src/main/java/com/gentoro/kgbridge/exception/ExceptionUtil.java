package com.gentoro.kgbridge.exception;

import java.util.function.Function;

/** Helpers for rendering and wrapping exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frames first.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Message of the root cause, falling back to the outermost message and then to the exception
   * type. Used for per-entity failure reasons where the driver wraps the store's own message.
   */
  public static String rootMessage(Throwable t) {
    if (t == null) return "Unknown error";
    Throwable current = t;
    String message = null;
    while (current != null) {
      if (current.getMessage() != null && !current.getMessage().isBlank()) {
        message = current.getMessage();
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }
    return message != null ? message.trim() : t.getClass().getSimpleName();
  }

  public static KgBridgeException rethrowIfUnchecked(
      Throwable t, Function<Throwable, KgBridgeException> supplier) {
    if (t instanceof KgBridgeException) {
      return (KgBridgeException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
