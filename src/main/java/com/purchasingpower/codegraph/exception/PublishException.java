package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class PublishException extends RuntimeException {

    private final String tenant;
    private final String sourceId;

    public PublishException(String tenant, String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.tenant = tenant;
        this.sourceId = sourceId;
    }
}
