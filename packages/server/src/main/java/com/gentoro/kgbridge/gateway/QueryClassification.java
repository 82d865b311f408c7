package com.gentoro.kgbridge.gateway;

/** Verdict of the read-only gate. An unsafe query is never executed. */
public record QueryClassification(Verdict verdict, String matchedToken) {

  public enum Verdict {
    SAFE,
    UNSAFE
  }

  public static QueryClassification safe() {
    return new QueryClassification(Verdict.SAFE, null);
  }

  public static QueryClassification unsafe(String matchedToken) {
    return new QueryClassification(Verdict.UNSAFE, matchedToken);
  }

  public boolean isSafe() {
    return verdict == Verdict.SAFE;
  }
}
