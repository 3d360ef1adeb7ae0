package com.purchasingpower.codegraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of graph nodes produced by extraction. The label doubles as the
 * Neo4j node label.
 *
 * @since 1.0.0
 */
public enum NodeKind {
    FUNCTION("Function"),
    SCRIPT("Script"),
    FILE("File"),
    MODULE("Module");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        for (NodeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + value);
    }
}
