package com.gentoro.kgbridge.importer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters and failures of one import run. Partial success is a normal result: callers inspect
 * the counts and {@link #failures()} instead of catching exceptions.
 */
public class ImportOutcome {
  private long nodesAttempted;
  private long nodesCreated;
  private long relationshipsAttempted;
  private long relationshipsCreated;
  private long statementsAttempted;
  private long statementsExecuted;
  private final List<EntityFailure> failures = new ArrayList<>();

  void nodeAttempted() {
    nodesAttempted++;
  }

  void nodeCreated() {
    nodesCreated++;
  }

  void relationshipAttempted() {
    relationshipsAttempted++;
  }

  void relationshipCreated() {
    relationshipsCreated++;
  }

  void statementAttempted() {
    statementsAttempted++;
  }

  void statementExecuted() {
    statementsExecuted++;
  }

  void recordFailure(EntityFailure failure) {
    failures.add(failure);
  }

  public long getNodesAttempted() {
    return nodesAttempted;
  }

  public long getNodesCreated() {
    return nodesCreated;
  }

  public long getRelationshipsAttempted() {
    return relationshipsAttempted;
  }

  public long getRelationshipsCreated() {
    return relationshipsCreated;
  }

  public long getStatementsAttempted() {
    return statementsAttempted;
  }

  public long getStatementsExecuted() {
    return statementsExecuted;
  }

  public List<EntityFailure> failures() {
    return Collections.unmodifiableList(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  @Override
  public String toString() {
    return "ImportOutcome{nodes="
        + nodesCreated
        + "/"
        + nodesAttempted
        + ", relationships="
        + relationshipsCreated
        + "/"
        + relationshipsAttempted
        + ", statements="
        + statementsExecuted
        + "/"
        + statementsAttempted
        + ", failures="
        + failures.size()
        + '}';
  }
}
