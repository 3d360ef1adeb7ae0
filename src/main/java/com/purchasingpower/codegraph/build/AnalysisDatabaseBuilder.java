package com.purchasingpower.codegraph.build;

import com.purchasingpower.codegraph.core.CodeSource;

import java.time.Instant;

/**
 * Builds (or reuses) the analysis database of one source and language.
 *
 * <p>Failures are returned as {@link BuildResult#failure}, never thrown.
 *
 * @since 1.0.0
 */
public interface AnalysisDatabaseBuilder {

    /**
     * Resolve the current revision and build for it.
     */
    BuildResult build(CodeSource source, String language);

    /**
     * Build for an already resolved revision.
     */
    default BuildResult build(CodeSource source, String language, String revision) {
        return build(source, language, revision, null);
    }

    /**
     * Build for an already resolved revision, giving up at {@code deadline}.
     *
     * @param deadline Latest completion time, or null for the configured build timeout only
     */
    BuildResult build(CodeSource source, String language, String revision, Instant deadline);
}
