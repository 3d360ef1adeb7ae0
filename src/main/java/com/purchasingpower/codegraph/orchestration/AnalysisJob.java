package com.purchasingpower.codegraph.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * One trigger and the outcomes of the sources it started.
 *
 * <p>Workers publish progress through {@link #update}; readers get consistent
 * snapshots of each outcome.
 */
public class AnalysisJob {

    public enum Status {
        RUNNING,
        DONE,
        FAILED;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase();
        }
    }

    @Getter
    private final String jobId;

    @Getter
    private final String tenant;

    @Getter
    private final Instant createdAt;

    private final List<String> sourceIds;
    private final Map<String, SourceOutcome> outcomes = new ConcurrentHashMap<>();

    public AnalysisJob(String jobId, String tenant, List<String> sourceIds) {
        this.jobId = jobId;
        this.tenant = tenant;
        this.sourceIds = List.copyOf(sourceIds);
        this.createdAt = Instant.now();
        sourceIds.forEach(id -> outcomes.put(id, SourceOutcome.pending(id)));
    }

    public List<String> getSourceIds() {
        return sourceIds;
    }

    public void update(String sourceId, UnaryOperator<SourceOutcome> transition) {
        outcomes.computeIfPresent(sourceId, (id, current) -> transition.apply(current));
    }

    public SourceOutcome getOutcome(String sourceId) {
        return outcomes.get(sourceId);
    }

    /**
     * Outcomes in trigger order.
     */
    public List<SourceOutcome> getOutcomes() {
        return sourceIds.stream().map(outcomes::get).toList();
    }

    public Status getStatus() {
        List<SourceOutcome> current = getOutcomes();
        if (current.stream().anyMatch(outcome -> !outcome.getStatus().isTerminal())) {
            return Status.RUNNING;
        }
        if (current.stream().anyMatch(outcome -> outcome.getStatus() == OutcomeStatus.FAILED)) {
            return Status.FAILED;
        }
        return Status.DONE;
    }

    public boolean isFinished() {
        return getStatus() != Status.RUNNING;
    }
}
