package com.purchasingpower.codegraph.orchestration;

import java.time.Duration;
import java.util.Optional;

/**
 * Drives the per-source pipeline: resolve revision, build if changed,
 * extract, publish, advance the registry.
 *
 * @since 1.0.0
 */
public interface AnalysisOrchestrator {

    /**
     * Start analysis of one source, or of every enabled source of the tenant
     * when {@code sourceId} is null. Returns immediately; units run on the
     * analysis executor.
     *
     * @param force   Run even when the revision is unchanged
     * @param timeout Deadline for the whole job, or null for {@code app.analysis.job-timeout}
     */
    TriggerResponse trigger(String tenant, String sourceId, boolean force, Duration timeout);

    Optional<AnalysisJob> getJob(String jobId);
}
