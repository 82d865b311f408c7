package com.gentoro.kgbridge.importer;

/**
 * One entity the import could not create.
 *
 * @param kind what failed
 * @param identifier external identifier (node), {@code start → end} (relationship), or statement
 *     ordinal (script)
 * @param type labels, relationship type, or a statement preview
 * @param reason store message or a description of the unresolved endpoint(s)
 */
public record EntityFailure(Kind kind, String identifier, String type, String reason) {

  public enum Kind {
    NODE,
    RELATIONSHIP,
    STATEMENT
  }

  @Override
  public String toString() {
    return kind + " " + identifier + " [" + type + "]: " + reason;
  }
}
