package com.purchasingpower.codegraph.graph;

import com.purchasingpower.codegraph.core.RelationTriple;

import java.util.List;

/**
 * Publishes extracted triples with full-rebuild-per-source semantics: after a
 * successful publish the subgraph tagged (tenant, sourceId) holds exactly the
 * given triples, and no other source's data has changed.
 *
 * @since 1.0.0
 */
public interface GraphPublisher {

    /**
     * @throws com.purchasingpower.codegraph.exception.PublishException if the graph store fails
     */
    PublishResult publish(String tenant, String sourceId, List<RelationTriple> triples);

    /**
     * Remove the published subgraph of a source.
     *
     * @throws com.purchasingpower.codegraph.exception.PublishException if the graph store fails
     */
    PublishResult deleteSource(String tenant, String sourceId);
}
