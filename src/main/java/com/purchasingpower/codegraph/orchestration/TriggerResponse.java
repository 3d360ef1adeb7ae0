package com.purchasingpower.codegraph.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immediate answer to an analysis trigger. Per-source results are read
 * later through the job id.
 */
@Value
@Builder
public class TriggerResponse {

    public enum Status {
        RUNNING,
        SKIPPED,
        REJECTED;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase();
        }
    }

    String jobId;
    Status status;
    String reason;

    @Singular
    List<String> sourceIds;

    public static TriggerResponse rejected(String reason) {
        return TriggerResponse.builder().status(Status.REJECTED).reason(reason).build();
    }

    public static TriggerResponse skipped(String reason) {
        return TriggerResponse.builder().status(Status.SKIPPED).reason(reason).build();
    }
}
