package com.purchasingpower.codegraph.exception;

public class QueryCatalogException extends RuntimeException {

    public QueryCatalogException(String message) {
        super(message);
    }

    public QueryCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
