package com.purchasingpower.codegraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

/**
 * Relationship type between two nodes.
 *
 * <p>Open-ended: a new kind comes from a query catalog entry, not from code.
 * The name is restricted to upper-case identifiers because it is used
 * verbatim as a Neo4j relationship type.
 *
 * @since 1.0.0
 */
public record RelationKind(String name) {

    private static final Pattern VALID_NAME = Pattern.compile("[A-Z][A-Z0-9_]*");

    public static final RelationKind CALLS = new RelationKind("CALLS");
    public static final RelationKind RUNS_SUBPROCESS = new RelationKind("RUNS_SUBPROCESS");
    public static final RelationKind IMPORTS = new RelationKind("IMPORTS");

    public RelationKind {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid relation kind: " + name);
        }
    }

    @JsonCreator
    public static RelationKind of(String name) {
        return new RelationKind(name == null ? null : name.trim().toUpperCase());
    }

    @JsonValue
    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
