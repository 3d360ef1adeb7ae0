package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.core.RelationKind;
import lombok.Value;

/**
 * A catalog query that produced no usable result.
 */
@Value
public class QueryError {
    String queryName;
    RelationKind relationKind;
    String message;
}
