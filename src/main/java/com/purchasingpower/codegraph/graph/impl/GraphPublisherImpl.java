package com.purchasingpower.codegraph.graph.impl;

import com.purchasingpower.codegraph.core.NodeDescriptor;
import com.purchasingpower.codegraph.core.RelationTriple;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.exception.PublishException;
import com.purchasingpower.codegraph.graph.CodeGraphStore;
import com.purchasingpower.codegraph.graph.GraphEdge;
import com.purchasingpower.codegraph.graph.GraphNode;
import com.purchasingpower.codegraph.graph.GraphPublisher;
import com.purchasingpower.codegraph.graph.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphPublisherImpl implements GraphPublisher {

    private final CodeGraphStore graphStore;

    @Override
    public PublishResult publish(String tenant, String sourceId, List<RelationTriple> triples) {
        checkArgument(tenant != null && !tenant.isBlank(), "Tenant is required");
        checkArgument(sourceId != null && !sourceId.isBlank(), "Source id is required");

        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Map<String, GraphEdge> edges = new LinkedHashMap<>();

        for (RelationTriple triple : triples) {
            GraphNode subject = addNode(nodes, tenant, sourceId, triple.subject());
            GraphNode object = addNode(nodes, tenant, sourceId, triple.object());

            GraphEdge edge = GraphEdge.builder()
                    .fromId(subject.getId())
                    .toId(object.getId())
                    .relationKind(triple.relationKind())
                    .tenant(tenant)
                    .sourceId(sourceId)
                    .build();
            edges.merge(edge.key(), edge,
                    (existing, repeated) -> existing.toBuilder().occurrences(existing.getOccurrences() + 1).build());
        }

        log.info("📤 Publishing {} nodes, {} edges for {} (from {} triples)",
                nodes.size(), edges.size(), sourceId, triples.size());

        try {
            PublishResult result = graphStore.replaceSubgraph(tenant, sourceId, nodes.values(), edges.values());
            log.info("✅ Published {}: -{} nodes, -{} edges, +{} nodes, +{} edges", sourceId,
                    result.getNodesDeleted(), result.getEdgesDeleted(), result.getNodesWritten(), result.getEdgesWritten());
            return result;
        } catch (GraphStoreException e) {
            log.error("❌ Publish failed for {}: {}", sourceId, e.getMessage());
            throw new PublishException(tenant, sourceId, "Graph publish failed: " + e.getMessage(), e);
        }
    }

    @Override
    public PublishResult deleteSource(String tenant, String sourceId) {
        try {
            PublishResult result = graphStore.deleteSubgraph(tenant, sourceId);
            log.info("🗑️  Deleted graph of {}: {} nodes, {} edges", sourceId, result.getNodesDeleted(), result.getEdgesDeleted());
            return result;
        } catch (GraphStoreException e) {
            throw new PublishException(tenant, sourceId, "Graph deletion failed: " + e.getMessage(), e);
        }
    }

    /**
     * Nodes are unique by identity within one publish. Line numbers missing on
     * the first sighting are taken from a later one.
     */
    private GraphNode addNode(Map<String, GraphNode> nodes, String tenant, String sourceId, NodeDescriptor descriptor) {
        GraphNode candidate = GraphNode.from(tenant, sourceId, descriptor);
        return nodes.merge(candidate.getId(), candidate, (existing, seen) -> {
            if (existing.getLineStart() != null || seen.getLineStart() == null) {
                return existing;
            }
            return existing.toBuilder().lineStart(seen.getLineStart()).lineEnd(seen.getLineEnd()).build();
        });
    }
}
