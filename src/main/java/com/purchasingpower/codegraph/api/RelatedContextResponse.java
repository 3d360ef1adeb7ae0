package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.graph.ContextFragment;
import com.purchasingpower.codegraph.graph.RetrievalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedContextResponse {

    /**
     * "results", "no_results" or "unavailable".
     */
    private String status;
    private String message;
    private List<ContextFragment> fragments;

    /**
     * One line per fragment, ready to drop into an incident briefing.
     */
    private List<String> context;

    public static RelatedContextResponse from(RetrievalResult result) {
        return RelatedContextResponse.builder()
                .status(result.getStatus().name().toLowerCase())
                .message(result.getMessage())
                .fragments(result.getFragments())
                .context(result.getFragments().stream().map(ContextFragment::describe).toList())
                .build();
    }
}
