package com.purchasingpower.codegraph.orchestration.impl;

import com.purchasingpower.codegraph.build.AnalysisDatabaseBuilder;
import com.purchasingpower.codegraph.build.BuildResult;
import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.core.AnalysisArtifact;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.core.RelationTriple;
import com.purchasingpower.codegraph.exception.PublishException;
import com.purchasingpower.codegraph.exception.RevisionUnavailableException;
import com.purchasingpower.codegraph.graph.GraphPublisher;
import com.purchasingpower.codegraph.graph.PublishResult;
import com.purchasingpower.codegraph.orchestration.AnalysisJob;
import com.purchasingpower.codegraph.orchestration.AnalysisJobTracker;
import com.purchasingpower.codegraph.orchestration.AnalysisLogContext;
import com.purchasingpower.codegraph.orchestration.AnalysisOrchestrator;
import com.purchasingpower.codegraph.orchestration.AnalysisStage;
import com.purchasingpower.codegraph.orchestration.FailureStage;
import com.purchasingpower.codegraph.orchestration.OutcomeStatus;
import com.purchasingpower.codegraph.orchestration.SourceLockRegistry;
import com.purchasingpower.codegraph.orchestration.TriggerResponse;
import com.purchasingpower.codegraph.query.ExtractionResult;
import com.purchasingpower.codegraph.query.QueryError;
import com.purchasingpower.codegraph.query.QueryExecutor;
import com.purchasingpower.codegraph.registry.SourceRegistry;
import com.purchasingpower.codegraph.revision.RevisionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one unit per source on the analysis executor.
 *
 * <pre>
 * PENDING → RESOLVING_REVISION → BUILDING → EXTRACTING → PUBLISHING → UPDATING_REGISTRY → DONE
 *                 │                  │                       │               │
 *                 └──────────────────┴─────── FAILED(stage, reason) ─────────┘
 * </pre>
 *
 * Units never throw: every error ends in a FAILED outcome of that source only.
 */
@Slf4j
@Service
public class AnalysisOrchestratorImpl implements AnalysisOrchestrator {

    static final String REVISION_UNCHANGED = "revision_unchanged";

    private final SourceRegistry sourceRegistry;
    private final RevisionResolver revisionResolver;
    private final AnalysisDatabaseBuilder databaseBuilder;
    private final QueryExecutor queryExecutor;
    private final GraphPublisher graphPublisher;
    private final AnalysisJobTracker jobTracker;
    private final SourceLockRegistry sourceLocks;
    private final AnalysisProperties properties;
    private final TaskExecutor analysisExecutor;

    public AnalysisOrchestratorImpl(SourceRegistry sourceRegistry,
                                    RevisionResolver revisionResolver,
                                    AnalysisDatabaseBuilder databaseBuilder,
                                    QueryExecutor queryExecutor,
                                    GraphPublisher graphPublisher,
                                    AnalysisJobTracker jobTracker,
                                    SourceLockRegistry sourceLocks,
                                    AnalysisProperties properties,
                                    @Qualifier("analysisExecutor") TaskExecutor analysisExecutor) {
        this.sourceRegistry = sourceRegistry;
        this.revisionResolver = revisionResolver;
        this.databaseBuilder = databaseBuilder;
        this.queryExecutor = queryExecutor;
        this.graphPublisher = graphPublisher;
        this.jobTracker = jobTracker;
        this.sourceLocks = sourceLocks;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;
    }

    @Override
    public TriggerResponse trigger(String tenant, String sourceId, boolean force, Duration timeout) {
        if (tenant == null || tenant.isBlank()) {
            return TriggerResponse.rejected("Tenant is required");
        }
        if (!properties.isTenantEnabled(tenant)) {
            log.warn("Analysis trigger rejected: static analysis not enabled for tenant {}", tenant);
            return TriggerResponse.rejected("Static analysis is not enabled for tenant " + tenant);
        }

        List<CodeSource> sources;
        if (sourceId != null && !sourceId.isBlank()) {
            Optional<CodeSource> source = sourceRegistry.find(sourceId);
            if (source.isEmpty() || !tenant.equals(source.get().getTenant())) {
                return TriggerResponse.rejected("Source " + sourceId + " is not registered for tenant " + tenant);
            }
            if (!source.get().isEnabled()) {
                return TriggerResponse.skipped("Source " + sourceId + " is disabled");
            }
            sources = List.of(source.get());
        } else {
            sources = sourceRegistry.list(tenant, null, true);
            if (sources.isEmpty()) {
                return TriggerResponse.skipped("No enabled sources for tenant " + tenant);
            }
        }

        Duration jobTimeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : properties.getJobTimeout();
        Instant deadline = Instant.now().plus(jobTimeout);
        AnalysisJob job = jobTracker.create(tenant, sources.stream().map(CodeSource::getSourceId).toList());

        log.info("🚀 Job {} started for tenant {}: {} sources (force={}, timeout={}s)",
                job.getJobId(), tenant, sources.size(), force, jobTimeout.toSeconds());

        for (CodeSource source : sources) {
            try {
                analysisExecutor.execute(() -> runUnit(job, source, force, deadline));
            } catch (TaskRejectedException e) {
                log.error("❌ Analysis executor rejected {}: {}", source.getSourceId(), e.getMessage());
                fail(job, source.getSourceId(), FailureStage.CANCELLED, "Analysis queue is full");
            }
        }

        return TriggerResponse.builder()
                .jobId(job.getJobId())
                .status(TriggerResponse.Status.RUNNING)
                .sourceIds(job.getSourceIds())
                .build();
    }

    @Override
    public Optional<AnalysisJob> getJob(String jobId) {
        return jobTracker.get(jobId);
    }

    void runUnit(AnalysisJob job, CodeSource source, boolean force, Instant deadline) {
        String sourceId = source.getSourceId();
        try (AnalysisLogContext ignored = new AnalysisLogContext(job.getJobId(), sourceId)) {
            job.update(sourceId, outcome -> outcome.toBuilder()
                    .stage(AnalysisStage.RESOLVING_REVISION)
                    .startedAt(Instant.now())
                    .build());
            try {
                analyze(job, source, force, deadline);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(job, sourceId, FailureStage.CANCELLED, "Interrupted");
            } catch (RuntimeException e) {
                AnalysisStage stage = job.getOutcome(sourceId).getStage();
                log.error("❌ Unexpected failure of {} during {}", sourceId, stage, e);
                fail(job, sourceId, FailureStage.of(stage), e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private void analyze(AnalysisJob job, CodeSource source, boolean force, Instant deadline) throws InterruptedException {
        String sourceId = source.getSourceId();

        // STEP 1: Resolve revision
        String revision;
        try {
            revision = revisionResolver.currentRevision(source);
        } catch (RevisionUnavailableException e) {
            fail(job, sourceId, FailureStage.RESOLVE, e.getMessage());
            return;
        }
        job.update(sourceId, outcome -> outcome.toBuilder().revision(revision).build());

        if (!force && revision.equals(source.getLastAnalyzedRevision())) {
            skip(job, sourceId, REVISION_UNCHANGED);
            return;
        }

        // STEP 2: Serialize with other runs of this source
        ReentrantLock lock = sourceLocks.lockFor(sourceId);
        if (!lock.tryLock(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
            fail(job, sourceId, FailureStage.CANCELLED, "Deadline expired waiting for a running analysis of this source");
            return;
        }

        try {
            // Another run may have finished this revision while we waited
            CodeSource current = sourceRegistry.find(sourceId).orElse(source);
            if (!force && revision.equals(current.getLastAnalyzedRevision())) {
                skip(job, sourceId, REVISION_UNCHANGED);
                return;
            }
            runPipeline(job, current, revision, deadline);
        } finally {
            lock.unlock();
        }
    }

    private void runPipeline(AnalysisJob job, CodeSource source, String revision, Instant deadline) {
        String sourceId = source.getSourceId();

        // STEP 3: Build one database per language
        transition(job, sourceId, AnalysisStage.BUILDING);
        Map<String, AnalysisArtifact> artifacts = new LinkedHashMap<>();
        for (String language : source.getLanguages()) {
            if (expired(deadline)) {
                fail(job, sourceId, FailureStage.CANCELLED, "Deadline expired before building " + language);
                return;
            }
            BuildResult result = databaseBuilder.build(source, language, revision, deadline);
            if (!result.isSuccess()) {
                FailureStage stage = expired(deadline) ? FailureStage.CANCELLED : FailureStage.BUILD;
                fail(job, sourceId, stage, result.getError().describe());
                return;
            }
            if (result.isCached()) {
                job.update(sourceId, outcome -> outcome.toBuilder().cachedLanguage(language).build());
            }
            artifacts.put(language, result.getArtifact());
        }

        // STEP 4: Extract, tolerating failed queries
        transition(job, sourceId, AnalysisStage.EXTRACTING);
        List<RelationTriple> triples = new ArrayList<>();
        List<String> queryFailures = new ArrayList<>();
        for (Map.Entry<String, AnalysisArtifact> entry : artifacts.entrySet()) {
            if (expired(deadline)) {
                fail(job, sourceId, FailureStage.CANCELLED, "Deadline expired before extracting " + entry.getKey());
                return;
            }
            ExtractionResult extraction = queryExecutor.extract(entry.getValue(), entry.getKey(), deadline);
            triples.addAll(extraction.getTriples());
            for (QueryError error : extraction.getFailures()) {
                queryFailures.add(error.getQueryName() + ": " + error.getMessage());
            }
            if (extraction.isPartial()) {
                log.warn("⚠️  Partial extraction for {} [{}]: {} of {} queries failed",
                        sourceId, entry.getKey(), extraction.getFailures().size(), extraction.getQueriesRun());
            }
        }
        job.update(sourceId, outcome -> outcome.toBuilder()
                .triplesExtracted(triples.size())
                .queryFailures(queryFailures)
                .build());

        if (expired(deadline)) {
            fail(job, sourceId, FailureStage.CANCELLED, "Deadline expired before publishing");
            return;
        }

        // STEP 5: Replace the source's subgraph
        transition(job, sourceId, AnalysisStage.PUBLISHING);
        PublishResult published;
        try {
            published = graphPublisher.publish(source.getTenant(), sourceId, triples);
        } catch (PublishException e) {
            fail(job, sourceId, FailureStage.PUBLISH, e.getMessage());
            return;
        }

        // STEP 6: Advance the registry only after the graph is in place
        transition(job, sourceId, AnalysisStage.UPDATING_REGISTRY);
        try {
            sourceRegistry.updateRevision(sourceId, revision, LocalDateTime.now());
        } catch (RuntimeException e) {
            log.error("❌ Registry update failed for {}", sourceId, e);
            fail(job, sourceId, FailureStage.UPDATE_REGISTRY, e.getMessage());
            return;
        }

        job.update(sourceId, outcome -> outcome.toBuilder()
                .status(OutcomeStatus.DONE)
                .stage(AnalysisStage.DONE)
                .nodesWritten(published.getNodesWritten())
                .edgesWritten(published.getEdgesWritten())
                .finishedAt(Instant.now())
                .build());
        log.info("✅ {} analyzed at {}: {} triples, {} nodes, {} edges", sourceId, revision,
                triples.size(), published.getNodesWritten(), published.getEdgesWritten());
    }

    private void transition(AnalysisJob job, String sourceId, AnalysisStage stage) {
        log.debug("{} -> {}", sourceId, stage);
        job.update(sourceId, outcome -> outcome.toBuilder().stage(stage).build());
    }

    private void skip(AnalysisJob job, String sourceId, String reason) {
        log.info("⏭️  Skipping {}: {}", sourceId, reason);
        job.update(sourceId, outcome -> outcome.toBuilder()
                .status(OutcomeStatus.SKIPPED)
                .stage(AnalysisStage.SKIPPED)
                .reason(reason)
                .finishedAt(Instant.now())
                .build());
    }

    private void fail(AnalysisJob job, String sourceId, FailureStage stage, String reason) {
        log.error("❌ {} failed at {}: {}", sourceId, stage, reason);
        job.update(sourceId, outcome -> outcome.toBuilder()
                .status(OutcomeStatus.FAILED)
                .stage(AnalysisStage.FAILED)
                .failureStage(stage)
                .reason(reason)
                .finishedAt(Instant.now())
                .build());
    }

    private static boolean expired(Instant deadline) {
        return !Instant.now().isBefore(deadline);
    }

    private static long remainingMillis(Instant deadline) {
        return Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
    }
}
