package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.core.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeSourceResponse {

    private String sourceId;
    private String tenant;
    private SourceType sourceType;
    private String path;
    private List<String> languages;
    private String name;
    private String branch;
    private String lastAnalyzedRevision;
    private LocalDateTime lastAnalyzedTime;
    private boolean enabled;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CodeSourceResponse from(CodeSource source) {
        return CodeSourceResponse.builder()
                .sourceId(source.getSourceId())
                .tenant(source.getTenant())
                .sourceType(source.getSourceType())
                .path(source.getPath())
                .languages(source.getLanguages())
                .name(source.getName())
                .branch(source.getEffectiveBranch())
                .lastAnalyzedRevision(source.getLastAnalyzedRevision())
                .lastAnalyzedTime(source.getLastAnalyzedTime())
                .enabled(source.isEnabled())
                .createdAt(source.getCreatedAt())
                .updatedAt(source.getUpdatedAt())
                .build();
    }
}
