package com.purchasingpower.codegraph.graph;

/**
 * Read-only access to the code graph, always scoped to one tenant.
 *
 * @since 1.0.0
 */
public interface GraphRetriever {

    /**
     * Nodes whose name or path matches the query, plus their one-hop
     * collaborators, ranked with closer name matches first.
     */
    RetrievalResult findRelated(String tenant, String queryText, int limit);

    /**
     * Functions that call the named function.
     */
    RetrievalResult callersOf(String tenant, String functionName, int limit);

    /**
     * Functions the named function calls.
     */
    RetrievalResult calleesOf(String tenant, String functionName, int limit);
}
