package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * Failure of the external analysis tool. The reason drives how the builder
 * classifies the error.
 */
@Getter
public class AnalysisToolException extends RuntimeException {

    public enum Reason {
        TOOL_MISSING,
        UNSUPPORTED_LANGUAGE,
        TIMEOUT,
        NON_ZERO_EXIT,
        MALFORMED_OUTPUT,
        IO_ERROR,
        INTERRUPTED
    }

    private final Reason reason;
    private final String toolOutput;

    public AnalysisToolException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public AnalysisToolException(Reason reason, String message, String toolOutput, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.toolOutput = toolOutput;
    }
}
