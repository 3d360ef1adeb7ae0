package com.purchasingpower.codegraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of removing the published graph and stored databases of a source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphCleanupResponse {
    private String sourceId;
    private String tenant;
    private int nodesDeleted;
    private int edgesDeleted;
    private int artifactsDeleted;
}
