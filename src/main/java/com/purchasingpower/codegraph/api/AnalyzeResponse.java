package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.codegraph.orchestration.TriggerResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyzeResponse {

    private String jobId;
    private String status;
    private String reason;
    private List<String> sourceIds;

    public static AnalyzeResponse from(TriggerResponse trigger) {
        return AnalyzeResponse.builder()
                .jobId(trigger.getJobId())
                .status(trigger.getStatus().getWireName())
                .reason(trigger.getReason())
                .sourceIds(trigger.getSourceIds())
                .build();
    }
}
