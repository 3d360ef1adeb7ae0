package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.orchestration.AnalysisJob;
import com.purchasingpower.codegraph.orchestration.SourceOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Job status with one outcome per source, including failure stage and reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private String jobId;
    private String tenant;
    private String status;
    private Instant createdAt;
    private List<SourceOutcome> outcomes;

    public static JobStatusResponse from(AnalysisJob job) {
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .tenant(job.getTenant())
                .status(job.getStatus().getWireName())
                .createdAt(job.getCreatedAt())
                .outcomes(job.getOutcomes())
                .build();
    }
}
