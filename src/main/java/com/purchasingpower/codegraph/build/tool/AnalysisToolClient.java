package com.purchasingpower.codegraph.build.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Narrow interface to the external static-analysis tool.
 *
 * <p>Every call is an external process bounded by a timeout. Failures are
 * reported as {@link com.purchasingpower.codegraph.exception.AnalysisToolException}
 * with a reason the caller can classify.
 *
 * @since 1.0.0
 */
public interface AnalysisToolClient {

    /**
     * Build an analysis database from a working copy.
     *
     * @param sourceRoot Working copy root
     * @param language Language to extract
     * @param databaseDir Target directory (overwritten)
     * @param buildCommand Optional build command for compiled languages, may be null
     * @param timeout Upper bound for the build
     * @return Directory of the created database
     */
    Path createDatabase(Path sourceRoot, String language, Path databaseDir, String buildCommand, Duration timeout);

    /**
     * Run one query and return the decoded result set.
     *
     * @return Decoded JSON ({@code {"#select": {"columns": [...], "tuples": [[...]]}}})
     */
    JsonNode runQuery(Path databaseDir, Path queryFile, Duration timeout);

    /**
     * @return true if the tool can be executed
     */
    boolean isAvailable();
}
