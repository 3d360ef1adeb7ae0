package com.purchasingpower.codegraph.exception;

public class WorkingCopyException extends RuntimeException {

    public WorkingCopyException(String message) {
        super(message);
    }

    public WorkingCopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
