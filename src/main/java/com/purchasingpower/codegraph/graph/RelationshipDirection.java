package com.purchasingpower.codegraph.graph;

/**
 * Edge direction relative to the node a traversal starts from.
 *
 * @since 1.0.0
 */
public enum RelationshipDirection {
    INCOMING,
    OUTGOING,
    BOTH
}
