package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.core.RelationKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One extraction query: which relation it produces, for which languages,
 * and how its result columns map onto subject and object nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryDefinition {

    private String name;
    private RelationKind relationKind;

    @Builder.Default
    private List<String> languages = new ArrayList<>();

    /**
     * Classpath location of the .ql file, e.g. {@code queries/python/call_graph.ql}.
     */
    private String query;

    private NodeMapping subject;
    private NodeMapping object;

    public boolean appliesTo(String language) {
        return language != null && languages.stream().anyMatch(language::equalsIgnoreCase);
    }
}
