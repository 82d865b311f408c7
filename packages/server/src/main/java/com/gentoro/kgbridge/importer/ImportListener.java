package com.gentoro.kgbridge.importer;

/**
 * User-facing progress of an import, kept apart from logging. Phases are {@code nodes}, {@code
 * relationships} and {@code statements}.
 */
public interface ImportListener {

  void beginPhase(String phase, long total);

  /** An entity was written; {@code description} is short text such as the node's display name. */
  void entityWritten(String phase, String description);

  void entityFailed(String phase, EntityFailure failure);

  void endPhase(String phase, long succeeded, long attempted);

  /** Free-form notice, e.g. the store being cleared. */
  default void notice(String message) {}

  default void beforeImport(GraphStats stats) {}

  default void afterImport(GraphStats stats) {}
}
