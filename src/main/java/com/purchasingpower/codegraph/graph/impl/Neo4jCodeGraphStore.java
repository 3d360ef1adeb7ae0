package com.purchasingpower.codegraph.graph.impl;

import com.purchasingpower.codegraph.core.NodeKind;
import com.purchasingpower.codegraph.core.RelationKind;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.graph.CodeGraphStore;
import com.purchasingpower.codegraph.graph.GraphEdge;
import com.purchasingpower.codegraph.graph.GraphNeighbor;
import com.purchasingpower.codegraph.graph.GraphNode;
import com.purchasingpower.codegraph.graph.PublishResult;
import com.purchasingpower.codegraph.graph.RelationshipDirection;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.SummaryCounters;
import org.neo4j.driver.types.Node;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Neo4j implementation of CodeGraphStore.
 *
 * <p>Every node carries the {@code CodeNode} label plus its kind label
 * ({@code Function}, {@code Script}, {@code File}, {@code Module}); the
 * relationship type is the relation kind. A subgraph replacement runs in a
 * single write transaction.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.analysis.graph-store", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jCodeGraphStore implements CodeGraphStore {

    private static final String DELETE_SUBGRAPH = """
        MATCH (n:CodeNode {tenant: $tenant, sourceId: $sourceId})
        DETACH DELETE n
        """;

    private static final String CREATE_NODES = """
        UNWIND $nodes AS node
        CREATE (n:CodeNode:%s)
        SET n = node
        """;

    private static final String CREATE_EDGES = """
        UNWIND $edges AS edge
        MATCH (from:CodeNode {id: edge.fromId})
        MATCH (to:CodeNode {id: edge.toId})
        CREATE (from)-[r:%s]->(to)
        SET r.tenant = edge.tenant,
            r.sourceId = edge.sourceId,
            r.occurrences = edge.occurrences
        """;

    private static final String FIND_NODES = """
        MATCH (n:CodeNode {tenant: $tenant})
        WHERE toLower(n.name) CONTAINS $text
           OR toLower(n.qualifiedName) CONTAINS $text
           OR toLower(n.filePath) CONTAINS $text
        WITH n, toLower(n.name) AS name, toLower(n.qualifiedName) AS qualifiedName
        WITH n, CASE
            WHEN name = $text OR qualifiedName = $text THEN 0
            WHEN qualifiedName ENDS WITH ('.' + $text) OR qualifiedName ENDS WITH ('/' + $text) THEN 1
            WHEN name STARTS WITH $text THEN 2
            WHEN name CONTAINS $text OR qualifiedName CONTAINS $text THEN 3
            ELSE 4
        END AS rank
        RETURN n
        ORDER BY rank, size(n.name), n.qualifiedName
        LIMIT $limit
        """;

    @org.springframework.beans.factory.annotation.Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @org.springframework.beans.factory.annotation.Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @org.springframework.beans.factory.annotation.Value("${neo4j.password:password}")
    private String neo4jPassword;

    private Driver driver;

    public Neo4jCodeGraphStore() {
    }

    Neo4jCodeGraphStore(Driver driver) {
        this.driver = driver;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j code graph store at: {}", neo4jUri);
        driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j code graph store connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX code_node_id IF NOT EXISTS FOR (n:CodeNode) ON (n.id)");
            session.run("CREATE INDEX code_node_source IF NOT EXISTS FOR (n:CodeNode) ON (n.tenant, n.sourceId)");
            session.run("CREATE INDEX code_node_name IF NOT EXISTS FOR (n:CodeNode) ON (n.tenant, n.name)");
            log.info("✅ Neo4j code graph indexes created");
        } catch (Neo4jException e) {
            log.warn("⚠️  Failed to create indexes (Neo4j may be down, will retry on next start): {}", e.getMessage());
        }
    }

    @Override
    public PublishResult replaceSubgraph(String tenant, String sourceId, Collection<GraphNode> nodes, Collection<GraphEdge> edges) {
        Map<NodeKind, List<Map<String, Object>>> nodesByKind = nodes.stream()
                .collect(Collectors.groupingBy(GraphNode::getKind, LinkedHashMap::new,
                        Collectors.mapping(GraphNode::toProperties, Collectors.toList())));
        Map<RelationKind, List<Map<String, Object>>> edgesByKind = edges.stream()
                .collect(Collectors.groupingBy(GraphEdge::getRelationKind, LinkedHashMap::new,
                        Collectors.mapping(Neo4jCodeGraphStore::edgeProperties, Collectors.toList())));

        try (Session session = driver.session()) {
            return session.executeWrite(tx -> {
                SummaryCounters deleted = deleteScoped(tx, tenant, sourceId);

                int nodesWritten = 0;
                for (Map.Entry<NodeKind, List<Map<String, Object>>> entry : nodesByKind.entrySet()) {
                    tx.run(String.format(CREATE_NODES, entry.getKey().getLabel()), Map.of("nodes", entry.getValue()));
                    nodesWritten += entry.getValue().size();
                }

                int edgesWritten = 0;
                for (Map.Entry<RelationKind, List<Map<String, Object>>> entry : edgesByKind.entrySet()) {
                    // Relation kinds are validated identifiers, safe to inline
                    tx.run(String.format(CREATE_EDGES, entry.getKey().name()), Map.of("edges", entry.getValue()));
                    edgesWritten += entry.getValue().size();
                }

                return PublishResult.builder()
                        .nodesDeleted(deleted.nodesDeleted())
                        .edgesDeleted(deleted.relationshipsDeleted())
                        .nodesWritten(nodesWritten)
                        .edgesWritten(edgesWritten)
                        .build();
            });
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j subgraph replacement failed for " + sourceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public PublishResult deleteSubgraph(String tenant, String sourceId) {
        try (Session session = driver.session()) {
            SummaryCounters deleted = session.executeWrite(tx -> deleteScoped(tx, tenant, sourceId));
            return PublishResult.builder()
                    .nodesDeleted(deleted.nodesDeleted())
                    .edgesDeleted(deleted.relationshipsDeleted())
                    .build();
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j subgraph deletion failed for " + sourceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<GraphNode> findNodes(String tenant, String text, int limit) {
        Map<String, Object> params = new HashMap<>();
        params.put("tenant", tenant);
        params.put("text", text.toLowerCase());
        params.put("limit", limit);

        try (Session session = driver.session()) {
            return session.executeRead(tx -> {
                Result result = tx.run(FIND_NODES, params);
                List<GraphNode> found = new ArrayList<>();
                while (result.hasNext()) {
                    found.add(toGraphNode(result.next().get("n").asNode()));
                }
                return found;
            });
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j node search failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<GraphNeighbor> findNeighbors(String tenant, String nodeId, RelationKind relationKind,
                                             RelationshipDirection direction, int limit) {
        String relFilter = relationKind != null ? ":" + relationKind.name() : "";
        Map<String, Object> params = Map.of("tenant", tenant, "id", nodeId, "limit", limit);

        try (Session session = driver.session()) {
            return session.executeRead(tx -> {
                List<GraphNeighbor> neighbors = new ArrayList<>();
                if (direction != RelationshipDirection.INCOMING) {
                    neighbors.addAll(neighbors(tx, "-[r%s]->", relFilter, params, RelationshipDirection.OUTGOING));
                }
                if (direction != RelationshipDirection.OUTGOING) {
                    neighbors.addAll(neighbors(tx, "<-[r%s]-", relFilter, params, RelationshipDirection.INCOMING));
                }
                return neighbors.size() > limit ? new ArrayList<>(neighbors.subList(0, limit)) : neighbors;
            });
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j neighbor lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long countNodes(String tenant, String sourceId) {
        return count("MATCH (n:CodeNode {tenant: $tenant, sourceId: $sourceId}) RETURN count(n) AS total", tenant, sourceId);
    }

    @Override
    public long countEdges(String tenant, String sourceId) {
        return count("MATCH (:CodeNode)-[r {tenant: $tenant, sourceId: $sourceId}]->(:CodeNode) RETURN count(r) AS total",
                tenant, sourceId);
    }

    @Override
    public boolean isAvailable() {
        try {
            driver.verifyConnectivity();
            return true;
        } catch (Neo4jException e) {
            log.warn("⚠️  Neo4j not available: {}", e.getMessage());
            return false;
        }
    }

    private SummaryCounters deleteScoped(TransactionContext tx, String tenant, String sourceId) {
        return tx.run(DELETE_SUBGRAPH, Map.of("tenant", tenant, "sourceId", sourceId))
                .consume()
                .counters();
    }

    private List<GraphNeighbor> neighbors(TransactionContext tx, String pattern, String relFilter,
                                          Map<String, Object> params, RelationshipDirection direction) {
        String cypher = String.format("""
            MATCH (n:CodeNode {id: $id, tenant: $tenant})%s(m:CodeNode {tenant: $tenant})
            RETURN m, type(r) AS kind, r.occurrences AS occurrences
            LIMIT $limit
            """, String.format(pattern, relFilter));

        Result result = tx.run(cypher, params);
        List<GraphNeighbor> neighbors = new ArrayList<>();
        while (result.hasNext()) {
            Record record = result.next();
            Value occurrences = record.get("occurrences");
            neighbors.add(new GraphNeighbor(
                    toGraphNode(record.get("m").asNode()),
                    RelationKind.of(record.get("kind").asString()),
                    direction,
                    occurrences.isNull() ? 1 : occurrences.asInt()));
        }
        return neighbors;
    }

    private long count(String cypher, String tenant, String sourceId) {
        try (Session session = driver.session()) {
            return session.executeRead(tx -> tx.run(cypher, Map.of("tenant", tenant, "sourceId", sourceId))
                    .single()
                    .get("total")
                    .asLong());
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j count failed for " + sourceId + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> edgeProperties(GraphEdge edge) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("fromId", edge.getFromId());
        properties.put("toId", edge.getToId());
        properties.put("tenant", edge.getTenant());
        properties.put("sourceId", edge.getSourceId());
        properties.put("occurrences", edge.getOccurrences());
        return properties;
    }

    private GraphNode toGraphNode(Node node) {
        return GraphNode.builder()
                .id(node.get("id").asString())
                .kind(NodeKind.fromValue(node.get("kind").asString()))
                .qualifiedName(node.get("qualifiedName").asString())
                .name(node.get("name").asString())
                .filePath(node.get("filePath").asString(""))
                .lineStart(getIntValue(node, "lineStart"))
                .lineEnd(getIntValue(node, "lineEnd"))
                .tenant(node.get("tenant").asString())
                .sourceId(node.get("sourceId").asString())
                .build();
    }

    private Integer getIntValue(Node node, String key) {
        Value value = node.get(key);
        return value.isNull() ? null : value.asInt();
    }
}
