package com.purchasingpower.codegraph.orchestration;

/**
 * Stage a source failed in. Nothing after the failing stage ran, and the
 * registry revision of the source is unchanged.
 */
public enum FailureStage {
    RESOLVE,
    BUILD,
    PUBLISH,
    UPDATE_REGISTRY,
    CANCELLED;

    /**
     * Failure stage an unexpected error at the given pipeline position maps to.
     */
    public static FailureStage of(AnalysisStage stage) {
        return switch (stage) {
            case PENDING, RESOLVING_REVISION -> RESOLVE;
            case BUILDING, EXTRACTING -> BUILD;
            case PUBLISHING -> PUBLISH;
            case UPDATING_REGISTRY, DONE, SKIPPED, FAILED -> UPDATE_REGISTRY;
        };
    }
}
