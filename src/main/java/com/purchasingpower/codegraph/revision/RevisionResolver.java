package com.purchasingpower.codegraph.revision;

import com.purchasingpower.codegraph.core.CodeSource;

/**
 * Resolves the current revision of a source (a commit hash for git sources).
 *
 * @since 1.0.0
 */
public interface RevisionResolver {

    /**
     * @param source Source to inspect
     * @return Opaque revision identifier, never null
     * @throws com.purchasingpower.codegraph.exception.RevisionUnavailableException
     *         if the hosting service is unreachable, credentials are rejected
     *         or the path does not exist
     */
    String currentRevision(CodeSource source);
}
