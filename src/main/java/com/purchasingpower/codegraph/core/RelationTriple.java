package com.purchasingpower.codegraph.core;

import java.util.Objects;

/**
 * A (subject, relation kind, object) fact extracted from an analysis database.
 *
 * @since 1.0.0
 */
public record RelationTriple(NodeDescriptor subject, RelationKind relationKind, NodeDescriptor object) {

    public RelationTriple {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(relationKind, "relationKind");
        Objects.requireNonNull(object, "object");
    }
}
