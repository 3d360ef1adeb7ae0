package com.purchasingpower.codegraph.graph.impl;

import com.purchasingpower.codegraph.core.NodeKind;
import com.purchasingpower.codegraph.core.RelationKind;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.graph.CodeGraphStore;
import com.purchasingpower.codegraph.graph.ContextFragment;
import com.purchasingpower.codegraph.graph.GraphNeighbor;
import com.purchasingpower.codegraph.graph.GraphNode;
import com.purchasingpower.codegraph.graph.GraphRetriever;
import com.purchasingpower.codegraph.graph.MatchType;
import com.purchasingpower.codegraph.graph.RelationshipDirection;
import com.purchasingpower.codegraph.graph.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphRetrieverImpl implements GraphRetriever {

    static final int CANDIDATE_LIMIT = 200;
    static final int EXPANDED_MATCHES = 5;
    static final int NEIGHBOR_LIMIT = 25;

    private final CodeGraphStore graphStore;

    @Override
    public RetrievalResult findRelated(String tenant, String queryText, int limit) {
        checkArgument(tenant != null && !tenant.isBlank(), "Tenant is required");
        checkArgument(limit > 0, "Limit must be positive");
        if (queryText == null || queryText.isBlank()) {
            return RetrievalResult.noResults("Empty query");
        }
        String query = queryText.trim();

        if (!graphStore.isAvailable()) {
            return RetrievalResult.unavailable("Graph store is not reachable");
        }

        try {
            // Phase 1: direct matches
            List<ContextFragment> matches = graphStore.findNodes(tenant, query, CANDIDATE_LIMIT).stream()
                    .map(node -> directMatch(node, query))
                    .sorted(RANKING)
                    .toList();

            if (matches.isEmpty()) {
                log.debug("No graph nodes match '{}' in tenant {}", query, tenant);
                return RetrievalResult.noResults("No code graph nodes match '" + query + "'");
            }

            Map<String, ContextFragment> fragments = new LinkedHashMap<>();
            matches.forEach(match -> fragments.putIfAbsent(match.getNodeId(), match));

            // Phase 2: one hop around the best matches
            for (ContextFragment match : matches.subList(0, Math.min(EXPANDED_MATCHES, matches.size()))) {
                for (GraphNeighbor neighbor : graphStore.findNeighbors(tenant, match.getNodeId(), null,
                        RelationshipDirection.BOTH, NEIGHBOR_LIMIT)) {
                    ContextFragment fragment = neighborFragment(neighbor, match);
                    fragments.merge(fragment.getNodeId(), fragment,
                            (existing, candidate) -> candidate.getScore() > existing.getScore() ? candidate : existing);
                }
            }

            List<ContextFragment> ranked = fragments.values().stream()
                    .sorted(RANKING)
                    .limit(limit)
                    .toList();

            log.info("🔎 Graph retrieval for '{}' in {}: {} matches, {} fragments returned",
                    query, tenant, matches.size(), ranked.size());
            return RetrievalResult.results(ranked);

        } catch (GraphStoreException e) {
            log.error("❌ Graph retrieval failed for tenant {}: {}", tenant, e.getMessage());
            return RetrievalResult.unavailable(e.getMessage());
        }
    }

    @Override
    public RetrievalResult callersOf(String tenant, String functionName, int limit) {
        return calls(tenant, functionName, limit, RelationshipDirection.INCOMING);
    }

    @Override
    public RetrievalResult calleesOf(String tenant, String functionName, int limit) {
        return calls(tenant, functionName, limit, RelationshipDirection.OUTGOING);
    }

    private RetrievalResult calls(String tenant, String functionName, int limit, RelationshipDirection direction) {
        checkArgument(tenant != null && !tenant.isBlank(), "Tenant is required");
        checkArgument(functionName != null && !functionName.isBlank(), "Function name is required");
        checkArgument(limit > 0, "Limit must be positive");

        if (!graphStore.isAvailable()) {
            return RetrievalResult.unavailable("Graph store is not reachable");
        }

        String name = functionName.trim();
        try {
            List<GraphNode> functions = graphStore.findNodes(tenant, name, CANDIDATE_LIMIT).stream()
                    .filter(node -> node.getKind() == NodeKind.FUNCTION)
                    .filter(node -> node.getName().equalsIgnoreCase(name) || node.getQualifiedName().equalsIgnoreCase(name))
                    .toList();
            if (functions.isEmpty()) {
                return RetrievalResult.noResults("No function named '" + name + "'");
            }

            Map<String, ContextFragment> fragments = new LinkedHashMap<>();
            for (GraphNode function : functions) {
                ContextFragment anchor = directMatch(function, name);
                for (GraphNeighbor neighbor : graphStore.findNeighbors(tenant, function.getId(), RelationKind.CALLS,
                        direction, limit)) {
                    fragments.putIfAbsent(neighbor.getNode().getId(), neighborFragment(neighbor, anchor));
                }
            }

            if (fragments.isEmpty()) {
                return RetrievalResult.noResults(direction == RelationshipDirection.INCOMING
                        ? "No callers of '" + name + "'"
                        : "'" + name + "' calls nothing in the graph");
            }
            return RetrievalResult.results(fragments.values().stream().sorted(RANKING).limit(limit).toList());

        } catch (GraphStoreException e) {
            log.error("❌ Call lookup failed for tenant {}: {}", tenant, e.getMessage());
            return RetrievalResult.unavailable(e.getMessage());
        }
    }

    static MatchType classify(GraphNode node, String query) {
        return MatchType.classify(node.getName(), node.getQualifiedName(), query);
    }

    private static ContextFragment directMatch(GraphNode node, String query) {
        MatchType matchType = classify(node, query);
        return fragment(node)
                .matchType(matchType)
                .score(matchType.getScore())
                .build();
    }

    private static ContextFragment neighborFragment(GraphNeighbor neighbor, ContextFragment parent) {
        return fragment(neighbor.getNode())
                .matchType(MatchType.NEIGHBOR)
                .score(parent.getScore() * MatchType.NEIGHBOR.getScore())
                .relationKind(neighbor.getRelationKind().name())
                .direction(neighbor.getDirection())
                .relatedTo(parent.getQualifiedName())
                .occurrences(neighbor.getOccurrences())
                .build();
    }

    private static ContextFragment.ContextFragmentBuilder fragment(GraphNode node) {
        return ContextFragment.builder()
                .nodeId(node.getId())
                .kind(node.getKind())
                .name(node.getName())
                .qualifiedName(node.getQualifiedName())
                .filePath(node.getFilePath())
                .lineStart(node.getLineStart())
                .sourceId(node.getSourceId());
    }

    private static final Comparator<ContextFragment> RANKING = Comparator
            .comparingDouble(ContextFragment::getScore).reversed()
            .thenComparing(fragment -> fragment.getMatchType() == MatchType.NEIGHBOR)
            .thenComparingInt(fragment -> fragment.getName().length())
            .thenComparing(ContextFragment::getQualifiedName);
}
