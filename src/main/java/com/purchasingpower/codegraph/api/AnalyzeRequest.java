package com.purchasingpower.codegraph.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Analysis trigger. Without {@code sourceId} every enabled source of the tenant runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

    @NotBlank(message = "Tenant is required")
    private String tenant;

    private String sourceId;

    /**
     * Run even when the revision has not changed.
     */
    private boolean force;

    @Positive
    private Long timeoutSeconds;
}
