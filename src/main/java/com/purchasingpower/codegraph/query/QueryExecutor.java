package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.core.AnalysisArtifact;

import java.time.Instant;

/**
 * Runs the catalog queries of a language against a built database.
 *
 * <p>Queries run independently. A failing query is reported in
 * {@link ExtractionResult#getFailures()} and never discards the triples of
 * the others.
 *
 * @since 1.0.0
 */
public interface QueryExecutor {

    default ExtractionResult extract(AnalysisArtifact artifact, String language) {
        return extract(artifact, language, null);
    }

    /**
     * @param deadline Latest completion time, or null for the configured per-query timeout only
     */
    ExtractionResult extract(AnalysisArtifact artifact, String language, Instant deadline);
}
