package com.purchasingpower.codegraph.build;

import com.purchasingpower.codegraph.core.AnalysisArtifact;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one database build. Exactly one of {@code artifact} and
 * {@code error} is set.
 */
@Value
@Builder
public class BuildResult {

    boolean success;
    AnalysisArtifact artifact;
    BuildError error;

    /**
     * True when the artifact came from the store and the tool was not run.
     */
    boolean cached;

    long durationMs;

    public static BuildResult built(AnalysisArtifact artifact, long durationMs) {
        return BuildResult.builder()
                .success(true)
                .artifact(artifact)
                .durationMs(durationMs)
                .build();
    }

    public static BuildResult cached(AnalysisArtifact artifact) {
        return BuildResult.builder()
                .success(true)
                .artifact(artifact)
                .cached(true)
                .build();
    }

    public static BuildResult failure(BuildError error, long durationMs) {
        return BuildResult.builder()
                .success(false)
                .error(error)
                .durationMs(durationMs)
                .build();
    }
}
