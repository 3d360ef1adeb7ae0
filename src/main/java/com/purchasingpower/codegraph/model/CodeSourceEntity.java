package com.purchasingpower.codegraph.model;

import com.purchasingpower.codegraph.core.SourceType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for one registered code source.
 *
 * Table: CODE_SOURCES, keyed by the derived source id.
 */
@Entity
@Table(name = "CODE_SOURCES", indexes = {
        @Index(name = "idx_source_tenant", columnList = "tenant"),
        @Index(name = "idx_source_type", columnList = "source_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeSourceEntity {

    @Id
    @Column(name = "source_id", length = 500)
    private String sourceId;

    @Column(name = "tenant", nullable = false, length = 100)
    private String tenant;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 30)
    private SourceType sourceType;

    @Column(name = "path", nullable = false, length = 1000)
    private String path;

    /**
     * Ordered language list, stored comma-separated.
     */
    @Convert(converter = StringListConverter.class)
    @Column(name = "languages", length = 500)
    @Builder.Default
    private List<String> languages = new ArrayList<>();

    @Column(name = "name", length = 500)
    private String name;

    @Column(name = "branch", length = 200)
    private String branch;

    @Column(name = "last_analyzed_revision", length = 100)
    private String lastAnalyzedRevision;

    @Column(name = "last_analyzed_time")
    private LocalDateTime lastAnalyzedTime;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
