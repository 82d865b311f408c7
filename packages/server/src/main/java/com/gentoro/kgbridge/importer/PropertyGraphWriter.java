package com.gentoro.kgbridge.importer;

import com.gentoro.kgbridge.exception.ExceptionUtil;
import com.gentoro.kgbridge.export.ExportedNode;
import com.gentoro.kgbridge.export.ExportedRelationship;
import com.gentoro.kgbridge.export.PropertyGraphExport;
import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.GraphSession;
import com.gentoro.kgbridge.store.StoreValues;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Writes a property-graph export in two phases: every node first, then every relationship.
 * Relationships find their endpoints through the identity marker, so the node phase must complete
 * before the first relationship is written. A relationship is only sent to the store when both
 * endpoints were created by this run; a marker left behind by an earlier import never satisfies
 * it.
 *
 * <p>Failures never abort the run. Each one is logged, reported to the listener and recorded in the
 * returned {@link ImportOutcome}; nothing is retried.
 */
public class PropertyGraphWriter {
  private static final Logger log = LoggingService.getLogger(PropertyGraphWriter.class);

  public static final String PHASE_NODES = "nodes";
  public static final String PHASE_RELATIONSHIPS = "relationships";

  private final String markerKey;
  private final StoreValues storeValues;

  public PropertyGraphWriter(String markerKey, StoreValues storeValues) {
    this.markerKey = markerKey;
    this.storeValues = storeValues;
  }

  public ImportOutcome write(
      PropertyGraphExport export, GraphSession session, ImportListener listener) {
    ImportOutcome outcome = new ImportOutcome();
    IdentityResolver identities = new IdentityResolver(markerKey);
    writeNodes(export, session, listener, outcome, identities);
    writeRelationships(export, session, listener, outcome, identities);
    log.info("Property graph written: {}", outcome);
    return outcome;
  }

  private void writeNodes(
      PropertyGraphExport export,
      GraphSession session,
      ImportListener listener,
      ImportOutcome outcome,
      IdentityResolver identities) {
    listener.beginPhase(PHASE_NODES, export.nodes().size());
    for (ExportedNode node : export.nodes()) {
      outcome.nodeAttempted();
      String labels = String.join(":", node.getLabels());
      try {
        Map<String, Object> props =
            identities.withMarker(node, storeValues.toStoreProperties(node.getProperties()));
        session.createNode(node.getLabels(), props);
        identities.recordCreated(node.getId());
        outcome.nodeCreated();
        listener.entityWritten(PHASE_NODES, labels + ": " + node.displayName());
      } catch (RuntimeException e) {
        EntityFailure failure =
            new EntityFailure(
                EntityFailure.Kind.NODE, node.getId().toString(), labels, reason(e));
        log.warn("Failed to create node {} ({}): {}", node.getId(), labels, failure.reason());
        log.debug("Node creation failure detail", e);
        outcome.recordFailure(failure);
        listener.entityFailed(PHASE_NODES, failure);
      }
    }
    listener.endPhase(PHASE_NODES, outcome.getNodesCreated(), outcome.getNodesAttempted());
  }

  private void writeRelationships(
      PropertyGraphExport export,
      GraphSession session,
      ImportListener listener,
      ImportOutcome outcome,
      IdentityResolver identities) {
    listener.beginPhase(PHASE_RELATIONSHIPS, export.relationships().size());
    for (ExportedRelationship rel : export.relationships()) {
      outcome.relationshipAttempted();
      String endpoints = rel.getStartNodeId() + " → " + rel.getEndNodeId();
      String reason;
      if (!identities.wasCreated(rel.getStartNodeId())
          || !identities.wasCreated(rel.getEndNodeId())) {
        reason = identities.describeUnresolved(rel);
        recordRelationshipFailure(rel, endpoints, reason, outcome, listener);
        continue;
      }
      try {
        long created =
            session.createRelationship(
                markerKey,
                identities.markerValue(rel.getStartNodeId()),
                identities.markerValue(rel.getEndNodeId()),
                rel.getType(),
                storeValues.toStoreProperties(rel.getProperties()));
        if (created > 0) {
          outcome.relationshipCreated();
          listener.entityWritten(PHASE_RELATIONSHIPS, rel.toString());
          continue;
        }
        reason = identities.describeUnresolved(rel);
      } catch (RuntimeException e) {
        log.debug("Relationship creation failure detail", e);
        reason = reason(e);
      }
      recordRelationshipFailure(rel, endpoints, reason, outcome, listener);
    }
    listener.endPhase(
        PHASE_RELATIONSHIPS,
        outcome.getRelationshipsCreated(),
        outcome.getRelationshipsAttempted());
  }

  private void recordRelationshipFailure(
      ExportedRelationship rel,
      String endpoints,
      String reason,
      ImportOutcome outcome,
      ImportListener listener) {
    EntityFailure failure =
        new EntityFailure(EntityFailure.Kind.RELATIONSHIP, endpoints, rel.getType(), reason);
    log.warn("Failed to create relationship [{}] {}: {}", rel.getType(), endpoints, reason);
    outcome.recordFailure(failure);
    listener.entityFailed(PHASE_RELATIONSHIPS, failure);
  }

  static String reason(Throwable t) {
    return ExceptionUtil.rootMessage(t);
  }
}
