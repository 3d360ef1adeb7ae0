package com.purchasingpower.codegraph.graph;

import com.purchasingpower.codegraph.core.RelationKind;
import lombok.Builder;
import lombok.Value;

/**
 * A directed edge between two nodes of the same source. Repeated triples
 * collapse into one edge and raise {@code occurrences}.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {

    String fromId;
    String toId;
    RelationKind relationKind;
    String tenant;
    String sourceId;

    @Builder.Default
    int occurrences = 1;

    public String key() {
        return fromId + "|" + relationKind.name() + "|" + toId;
    }
}
