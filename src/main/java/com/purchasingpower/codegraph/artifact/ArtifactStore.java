package com.purchasingpower.codegraph.artifact;

import com.purchasingpower.codegraph.core.AnalysisArtifact;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persists built analysis databases, addressed by
 * {@code tenant / sourceId / language / revision}.
 *
 * <p>Implementations decide where the bytes live. Callers only see
 * {@link AnalysisArtifact#getLocation()}, which must be a path the analysis
 * tool can open on this host.
 *
 * @since 1.0.0
 */
public interface ArtifactStore {

    /**
     * Store a freshly built database. The database directory is moved into
     * the store when it is not already there. Older revisions of the same
     * language are discarded once this one is the latest.
     */
    AnalysisArtifact put(String tenant, String sourceId, String language, String revision, Path databasePath);

    /**
     * @return the most recently stored artifact for the language
     */
    Optional<AnalysisArtifact> get(String tenant, String sourceId, String language);

    /**
     * @return the artifact for an exact revision, if it is still present
     */
    Optional<AnalysisArtifact> find(String tenant, String sourceId, String language, String revision);

    /**
     * @param tenant Tenant filter, or null for all tenants
     */
    List<AnalysisArtifact> list(String tenant);

    /**
     * Remove every stored artifact of a source.
     *
     * @return number of artifacts removed
     */
    int delete(String tenant, String sourceId);

    /**
     * Where a new database for this key should be built. Backends that build
     * remotely return a scratch directory here.
     */
    Path stagingPath(String tenant, String sourceId, String language, String revision);
}
