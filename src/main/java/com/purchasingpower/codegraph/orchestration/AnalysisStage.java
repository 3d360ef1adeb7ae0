package com.purchasingpower.codegraph.orchestration;

/**
 * Pipeline position of one source within a job.
 */
public enum AnalysisStage {
    PENDING,
    RESOLVING_REVISION,
    BUILDING,
    EXTRACTING,
    PUBLISHING,
    UPDATING_REGISTRY,
    DONE,
    SKIPPED,
    FAILED
}
