package com.gentoro.kgbridge.store.neo4j;

import com.gentoro.kgbridge.logging.LoggingService;
import com.gentoro.kgbridge.store.CypherNames;
import com.gentoro.kgbridge.store.GraphSession;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.neo4j.driver.Session;
import org.slf4j.Logger;

/** {@link GraphSession} over one Neo4j driver session. Writes run as auto-commit statements. */
public class Neo4jGraphSession implements GraphSession {
  private static final Logger log = LoggingService.getLogger(Neo4jGraphSession.class);

  private final Session session;

  public Neo4jGraphSession(Session session) {
    this.session = session;
  }

  @Override
  public void createNode(List<String> labels, Map<String, Object> properties) {
    String cypher = "CREATE (n" + CypherNames.labelExpression(labels) + " $props)";
    log.trace("{}", cypher);
    session.run(cypher, Map.of("props", properties)).consume();
  }

  @Override
  public long createRelationship(
      String identityKey,
      Object startId,
      Object endId,
      String type,
      Map<String, Object> properties) {
    String key = CypherNames.quote(identityKey);
    String cypher =
        "MATCH (a {"
            + key
            + ": $startId}), (b {"
            + key
            + ": $endId}) CREATE (a)-[r:"
            + CypherNames.quote(type)
            + " $props]->(b) RETURN count(r) AS created";
    log.trace("{}", cypher);
    Map<String, Object> params = new HashMap<>();
    params.put("startId", startId);
    params.put("endId", endId);
    params.put("props", properties);
    return session.run(cypher, params).single().get("created").asLong();
  }

  @Override
  public void execute(String statement) {
    log.trace("{}", statement);
    session.run(statement).consume();
  }

  @Override
  public long clearAll() {
    return session.run("MATCH (n) DETACH DELETE n").consume().counters().nodesDeleted();
  }

  @Override
  public long removeProperty(String key) {
    String k = CypherNames.quote(key);
    return session
        .run("MATCH (n) WHERE n." + k + " IS NOT NULL REMOVE n." + k + " RETURN count(n) AS c")
        .single()
        .get("c")
        .asLong();
  }

  @Override
  public List<String> labels() {
    return session
        .run("CALL db.labels() YIELD label RETURN label ORDER BY label")
        .list(r -> r.get("label").asString());
  }

  @Override
  public List<String> relationshipTypes() {
    return session
        .run(
            "CALL db.relationshipTypes() YIELD relationshipType "
                + "RETURN relationshipType ORDER BY relationshipType")
        .list(r -> r.get("relationshipType").asString());
  }

  @Override
  public List<String> propertyKeys() {
    return session
        .run("CALL db.propertyKeys() YIELD propertyKey RETURN propertyKey ORDER BY propertyKey")
        .list(r -> r.get("propertyKey").asString());
  }

  @Override
  public List<String> frequentPropertyKeys(String label, int sampleSize, int limit) {
    String cypher =
        "MATCH (n:"
            + CypherNames.quote(label)
            + ") WITH n LIMIT $sample UNWIND keys(n) AS k "
            + "RETURN k, count(*) AS c ORDER BY c DESC, k LIMIT $limit";
    return session
        .run(cypher, Map.of("sample", sampleSize, "limit", limit))
        .list(r -> r.get("k").asString());
  }

  @Override
  public long countNodes() {
    return session.run("MATCH (n) RETURN count(n) AS c").single().get("c").asLong();
  }

  @Override
  public long countRelationships() {
    return session.run("MATCH ()-[r]->() RETURN count(r) AS c").single().get("c").asLong();
  }

  @Override
  public List<Map<String, Object>> sampleNodes(String label, int limit) {
    String cypher = "MATCH (n:" + CypherNames.quote(label) + ") RETURN n{.*} AS node LIMIT $limit";
    return session.executeRead(
        tx ->
            tx.run(cypher, Map.of("limit", limit))
                .list(r -> Neo4jValues.toPropertyMap(r.get("node"))));
  }

  @Override
  public List<Map<String, Object>> runReadQuery(String query) {
    log.debug("Running read query: {}", query);
    return session.executeRead(tx -> tx.run(query).list(Neo4jValues::toRow));
  }

  @Override
  public void close() {
    session.close();
  }
}
