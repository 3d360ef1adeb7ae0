package com.purchasingpower.codegraph.graph;

import com.purchasingpower.codegraph.core.NodeKind;
import lombok.Builder;
import lombok.Value;

/**
 * One ranked piece of graph context: a matched node, or a direct collaborator
 * of a matched node together with the relation that links them.
 */
@Value
@Builder
public class ContextFragment {

    String nodeId;
    NodeKind kind;
    String name;
    String qualifiedName;
    String filePath;
    Integer lineStart;
    String sourceId;

    double score;
    MatchType matchType;

    /**
     * Set for neighbor fragments only.
     */
    String relationKind;
    RelationshipDirection direction;
    String relatedTo;
    int occurrences;

    /**
     * One-line rendering for prompts and logs, e.g. {@code billing.run CALLS billing.charge (billing/run.py:12)}.
     */
    public String describe() {
        String location = filePath == null || filePath.isEmpty() ? "" :
                " (" + filePath + (lineStart != null ? ":" + lineStart : "") + ")";
        if (matchType != MatchType.NEIGHBOR) {
            return kind.getLabel() + " " + qualifiedName + location;
        }
        return direction == RelationshipDirection.OUTGOING
                ? relatedTo + " " + relationKind + " " + qualifiedName + location
                : qualifiedName + " " + relationKind + " " + relatedTo + location;
    }
}
