package com.purchasingpower.codegraph.graph;

import com.purchasingpower.codegraph.core.RelationKind;

import java.util.Collection;
import java.util.List;

/**
 * Storage for code graph nodes and edges.
 *
 * <p>Every write is scoped by (tenant, sourceId) and every read by tenant.
 * Implementations throw {@link com.purchasingpower.codegraph.exception.GraphStoreException}
 * when the backing store fails.
 *
 * @since 1.0.0
 */
public interface CodeGraphStore {

    /**
     * Atomically delete everything tagged (tenant, sourceId) and insert the given nodes and edges.
     */
    PublishResult replaceSubgraph(String tenant, String sourceId, Collection<GraphNode> nodes, Collection<GraphEdge> edges);

    /**
     * Delete everything tagged (tenant, sourceId).
     */
    PublishResult deleteSubgraph(String tenant, String sourceId);

    /**
     * Nodes of the tenant whose name, qualified name or file path contains the text, ignoring case.
     * Best matches come first (see {@link MatchType#classify}), so the limit never drops an
     * exact name in favor of a weaker substring match.
     */
    List<GraphNode> findNodes(String tenant, String text, int limit);

    /**
     * One-hop neighbors of a node.
     *
     * @param relationKind Relation filter, or null for every kind
     */
    List<GraphNeighbor> findNeighbors(String tenant, String nodeId, RelationKind relationKind,
                                      RelationshipDirection direction, int limit);

    long countNodes(String tenant, String sourceId);

    long countEdges(String tenant, String sourceId);

    boolean isAvailable();
}
