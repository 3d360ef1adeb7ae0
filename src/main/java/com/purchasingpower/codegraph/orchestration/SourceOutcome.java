package com.purchasingpower.codegraph.orchestration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Progress and result of one source within a job. Immutable; the job
 * replaces it on every transition.
 */
@Value
@Builder(toBuilder = true)
public class SourceOutcome {

    String sourceId;

    @Builder.Default
    OutcomeStatus status = OutcomeStatus.RUNNING;

    @Builder.Default
    AnalysisStage stage = AnalysisStage.PENDING;

    FailureStage failureStage;

    /**
     * Human readable failure or skip reason.
     */
    String reason;

    String revision;

    /**
     * Languages whose database was reused instead of rebuilt.
     */
    @Singular("cachedLanguage")
    List<String> cachedLanguages;

    int triplesExtracted;
    int nodesWritten;
    int edgesWritten;

    @Singular
    List<String> queryFailures;

    Instant startedAt;
    Instant finishedAt;

    public static SourceOutcome pending(String sourceId) {
        return SourceOutcome.builder().sourceId(sourceId).build();
    }
}
