package com.purchasingpower.codegraph.graph;

import lombok.Value;

import java.util.List;

/**
 * Retriever answer. An empty fragment list always comes with a status that
 * says whether the graph had nothing or could not be asked.
 */
@Value
public class RetrievalResult {

    public enum Status {
        RESULTS,
        NO_RESULTS,
        UNAVAILABLE
    }

    Status status;
    List<ContextFragment> fragments;
    String message;

    public static RetrievalResult results(List<ContextFragment> fragments) {
        return new RetrievalResult(Status.RESULTS, List.copyOf(fragments), fragments.size() + " fragments");
    }

    public static RetrievalResult noResults(String message) {
        return new RetrievalResult(Status.NO_RESULTS, List.of(), message);
    }

    public static RetrievalResult unavailable(String message) {
        return new RetrievalResult(Status.UNAVAILABLE, List.of(), message);
    }
}
