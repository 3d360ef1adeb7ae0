package com.purchasingpower.codegraph.build;

/**
 * Classification of a failed database build.
 */
public enum BuildErrorType {
    TOOL_MISSING,
    UNSUPPORTED_LANGUAGE,
    BUILD_TIMEOUT,
    BUILD_CRASH,
    WORKING_COPY_UNAVAILABLE,
    REVISION_UNAVAILABLE
}
