package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * The current revision of a source could not be determined (hosting API
 * unreachable, authentication failure, path missing). Not retried internally;
 * the next trigger retries.
 */
@Getter
public class RevisionUnavailableException extends RuntimeException {

    private final String sourceId;

    public RevisionUnavailableException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public RevisionUnavailableException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }
}
