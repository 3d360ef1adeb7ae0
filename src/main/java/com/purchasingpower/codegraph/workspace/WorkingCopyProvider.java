package com.purchasingpower.codegraph.workspace;

import com.purchasingpower.codegraph.core.CodeSource;

import java.nio.file.Path;

/**
 * Materializes the source tree a database is built from.
 *
 * @since 1.0.0
 */
public interface WorkingCopyProvider {

    /**
     * Make the working copy of {@code source} reflect {@code revision}.
     *
     * @param source Source to materialize
     * @param revision Revision to check out (ignored for plain directories)
     * @return Root directory of the working copy
     * @throws com.purchasingpower.codegraph.exception.WorkingCopyException on clone/checkout failure
     */
    Path materialize(CodeSource source, String revision);
}
