package com.purchasingpower.codegraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered body of code (repository or filesystem path) eligible for analysis.
 *
 * <p>The id is derived from (tenant, sourceType, path), so registering the same
 * triple twice always addresses the same registry entry.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CodeSource {

    public static final String DEFAULT_BRANCH = "main";

    private String sourceId;
    private String tenant;
    private SourceType sourceType;
    private String path;

    @Builder.Default
    private List<String> languages = new ArrayList<>();

    private String name;
    private String branch;

    /**
     * Revision whose graph data is currently published. Null means never analyzed.
     */
    private String lastAnalyzedRevision;
    private LocalDateTime lastAnalyzedTime;

    @Builder.Default
    private boolean enabled = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public String getEffectiveBranch() {
        return branch != null && !branch.isBlank() ? branch : DEFAULT_BRANCH;
    }

    public boolean isNeverAnalyzed() {
        return lastAnalyzedRevision == null;
    }

    /**
     * Derives the stable source id, e.g. {@code claims_hosted-repository_org_svc}.
     *
     * <p>Path separators become {@code _}, so {@code org/svc} and {@code org_svc}
     * share an id. The registry rejects the second of two such paths.
     */
    public static String deriveSourceId(String tenant, SourceType sourceType, String path) {
        if (tenant == null || tenant.isBlank()) {
            throw new IllegalArgumentException("Tenant is required");
        }
        if (sourceType == null) {
            throw new IllegalArgumentException("Source type is required");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path is required");
        }
        String safePath = path.trim().replace("/", "_").replace("\\", "_");
        return tenant.trim() + "_" + sourceType.getWireName() + "_" + safePath;
    }
}
