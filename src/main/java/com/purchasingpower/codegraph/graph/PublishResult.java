package com.purchasingpower.codegraph.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of one subgraph replacement (or deletion).
 */
@Value
@Builder
public class PublishResult {
    int nodesDeleted;
    int edgesDeleted;
    int nodesWritten;
    int edgesWritten;
}
