package com.purchasingpower.codegraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A built analysis database for one source + language + revision.
 * Never mutated after it is stored; a new revision supersedes it.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisArtifact {

    private String tenant;
    private String sourceId;
    private String language;
    private String revision;

    /**
     * Backend-specific location of the database (a directory for the local store).
     */
    private String location;

    private Instant builtAt;
}
