package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the {@code app.analysis} configuration tree.
 *
 * <pre>
 * app:
 *   analysis:
 *     enabled: true
 *     workspace-dir: data/workspaces
 *     job-timeout: 2h
 *     codeql:
 *       executable: codeql
 *     tenants:
 *       claims:
 *         enabled: true
 *         sources:
 *           - type: hosted-repository
 *             path: org/svc
 *             languages: [python]
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisProperties {

    /**
     * Global switch. When false every trigger is rejected.
     */
    private boolean enabled = true;

    @NotBlank(message = "Workspace directory path is required")
    private String workspaceDir = "data/workspaces";

    @NotNull
    private Duration jobTimeout = Duration.ofHours(2);

    @Min(1)
    private int maxRetainedJobs = 200;

    /**
     * Graph store backend: "neo4j" or "memory".
     */
    @NotBlank
    private String graphStore = "neo4j";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CodeQlProperties codeql = new CodeQlProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ArtifactProperties artifacts = new ArtifactProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private HostingProperties hosting = new HostingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExecutorProperties executor = new ExecutorProperties();

    @Valid
    @NotNull
    private Map<String, TenantProperties> tenants = new LinkedHashMap<>();

    public boolean isTenantEnabled(String tenant) {
        if (!enabled || tenant == null) {
            return false;
        }
        TenantProperties tenantProperties = tenants.get(tenant);
        return tenantProperties != null && tenantProperties.isEnabled();
    }
}
