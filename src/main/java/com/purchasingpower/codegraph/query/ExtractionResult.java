package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.core.RelationTriple;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Triples produced by every query that succeeded, plus the queries that did not.
 */
@Value
@Builder
public class ExtractionResult {

    @Singular
    List<RelationTriple> triples;

    @Singular
    List<QueryError> failures;

    int queriesRun;

    /**
     * Rows that could not be mapped to a triple.
     */
    int skippedRows;

    public boolean isPartial() {
        return !failures.isEmpty();
    }

    public static ExtractionResult empty() {
        return ExtractionResult.builder().build();
    }
}
