package com.purchasingpower.codegraph.graph;

import com.purchasingpower.codegraph.core.RelationKind;
import lombok.Value;

/**
 * A node one hop away from a start node, with the edge that connects them.
 */
@Value
public class GraphNeighbor {
    GraphNode node;
    RelationKind relationKind;
    RelationshipDirection direction;
    int occurrences;
}
