package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class SourceNotFoundException extends RuntimeException {

    private final String sourceId;

    public SourceNotFoundException(String sourceId) {
        super("Source not found: " + sourceId);
        this.sourceId = sourceId;
    }
}
