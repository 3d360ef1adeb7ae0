package com.purchasingpower.codegraph.orchestration;

import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Status map of analysis jobs, keyed by job id. Finished jobs beyond
 * {@code app.analysis.max-retained-jobs} are evicted oldest first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisJobTracker {

    private final AnalysisProperties properties;

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> creationOrder = new ConcurrentLinkedDeque<>();

    public AnalysisJob create(String tenant, List<String> sourceIds) {
        AnalysisJob job = new AnalysisJob(UUID.randomUUID().toString(), tenant, sourceIds);
        jobs.put(job.getJobId(), job);
        creationOrder.addLast(job.getJobId());
        evictFinished();
        return job;
    }

    public Optional<AnalysisJob> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public int size() {
        return jobs.size();
    }

    private void evictFinished() {
        int excess = jobs.size() - properties.getMaxRetainedJobs();
        for (String jobId : creationOrder) {
            if (excess <= 0) {
                break;
            }
            AnalysisJob job = jobs.get(jobId);
            if (job == null) {
                creationOrder.remove(jobId);
            } else if (job.isFinished()) {
                jobs.remove(jobId);
                creationOrder.remove(jobId);
                excess--;
                log.debug("Evicted finished job {}", jobId);
            }
        }
    }
}
