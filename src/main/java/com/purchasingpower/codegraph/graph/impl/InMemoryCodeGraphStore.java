package com.purchasingpower.codegraph.graph.impl;

import com.purchasingpower.codegraph.core.RelationKind;
import com.purchasingpower.codegraph.graph.CodeGraphStore;
import com.purchasingpower.codegraph.graph.GraphEdge;
import com.purchasingpower.codegraph.graph.GraphNeighbor;
import com.purchasingpower.codegraph.graph.GraphNode;
import com.purchasingpower.codegraph.graph.MatchType;
import com.purchasingpower.codegraph.graph.PublishResult;
import com.purchasingpower.codegraph.graph.RelationshipDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local graph store for development and tests
 * ({@code app.analysis.graph-store=memory}). Nothing survives a restart.
 * Replacement happens under the write lock, so readers never see a half
 * rebuilt source.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.analysis.graph-store", havingValue = "memory")
public class InMemoryCodeGraphStore implements CodeGraphStore {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryCodeGraphStore() {
        log.info("Using in-memory code graph store");
    }

    @Override
    public PublishResult replaceSubgraph(String tenant, String sourceId, Collection<GraphNode> newNodes, Collection<GraphEdge> newEdges) {
        lock.writeLock().lock();
        try {
            PublishResult deleted = removeScoped(tenant, sourceId);
            newNodes.forEach(node -> nodes.put(node.getId(), node));
            newEdges.forEach(edge -> edges.put(edge.key(), edge));
            return PublishResult.builder()
                    .nodesDeleted(deleted.getNodesDeleted())
                    .edgesDeleted(deleted.getEdgesDeleted())
                    .nodesWritten(newNodes.size())
                    .edgesWritten(newEdges.size())
                    .build();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public PublishResult deleteSubgraph(String tenant, String sourceId) {
        lock.writeLock().lock();
        try {
            return removeScoped(tenant, sourceId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<GraphNode> findNodes(String tenant, String text, int limit) {
        String needle = text.toLowerCase();
        lock.readLock().lock();
        try {
            return nodes.values().stream()
                    .filter(node -> tenant.equals(node.getTenant()))
                    .filter(node -> contains(node.getName(), needle)
                            || contains(node.getQualifiedName(), needle)
                            || contains(node.getFilePath(), needle))
                    .sorted(Comparator.comparing((GraphNode node) -> MatchType.classify(node.getName(), node.getQualifiedName(), needle))
                            .thenComparingInt(node -> node.getName() == null ? 0 : node.getName().length())
                            .thenComparing(node -> Objects.toString(node.getQualifiedName(), "")))
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GraphNeighbor> findNeighbors(String tenant, String nodeId, RelationKind relationKind,
                                             RelationshipDirection direction, int limit) {
        lock.readLock().lock();
        try {
            List<GraphNeighbor> neighbors = new ArrayList<>();
            for (GraphEdge edge : edges.values()) {
                if (!tenant.equals(edge.getTenant())
                        || (relationKind != null && !relationKind.equals(edge.getRelationKind()))) {
                    continue;
                }
                if (direction != RelationshipDirection.INCOMING && edge.getFromId().equals(nodeId)) {
                    addNeighbor(neighbors, tenant, edge.getToId(), edge, RelationshipDirection.OUTGOING);
                }
                if (direction != RelationshipDirection.OUTGOING && edge.getToId().equals(nodeId)) {
                    addNeighbor(neighbors, tenant, edge.getFromId(), edge, RelationshipDirection.INCOMING);
                }
                if (neighbors.size() >= limit) {
                    break;
                }
            }
            return neighbors.size() > limit ? new ArrayList<>(neighbors.subList(0, limit)) : neighbors;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countNodes(String tenant, String sourceId) {
        lock.readLock().lock();
        try {
            return nodes.values().stream().filter(node -> inScope(node.getTenant(), node.getSourceId(), tenant, sourceId)).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countEdges(String tenant, String sourceId) {
        lock.readLock().lock();
        try {
            return edges.values().stream().filter(edge -> inScope(edge.getTenant(), edge.getSourceId(), tenant, sourceId)).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private void addNeighbor(List<GraphNeighbor> neighbors, String tenant, String otherId, GraphEdge edge,
                             RelationshipDirection direction) {
        GraphNode other = nodes.get(otherId);
        if (other != null && tenant.equals(other.getTenant())) {
            neighbors.add(new GraphNeighbor(other, edge.getRelationKind(), direction, edge.getOccurrences()));
        }
    }

    private PublishResult removeScoped(String tenant, String sourceId) {
        int edgesBefore = edges.size();
        int nodesBefore = nodes.size();
        edges.values().removeIf(edge -> inScope(edge.getTenant(), edge.getSourceId(), tenant, sourceId));
        nodes.values().removeIf(node -> inScope(node.getTenant(), node.getSourceId(), tenant, sourceId));
        return PublishResult.builder()
                .nodesDeleted(nodesBefore - nodes.size())
                .edgesDeleted(edgesBefore - edges.size())
                .build();
    }

    private static boolean inScope(String tenant, String sourceId, String expectedTenant, String expectedSourceId) {
        return Objects.equals(tenant, expectedTenant) && Objects.equals(sourceId, expectedSourceId);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase().contains(needle);
    }
}
