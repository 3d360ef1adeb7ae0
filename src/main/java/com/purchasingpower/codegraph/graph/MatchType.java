package com.purchasingpower.codegraph.graph;

/**
 * How a fragment matched the query, strongest first.
 */
public enum MatchType {
    EXACT_NAME(1.0),
    QUALIFIED_SUFFIX(0.95),
    NAME_PREFIX(0.9),
    SUBSTRING(0.8),
    FILE_PATH(0.6),
    NEIGHBOR(0.9);

    private final double score;

    MatchType(double score) {
        this.score = score;
    }

    /**
     * Score of a direct match; for {@link #NEIGHBOR} the factor applied to the parent's score.
     */
    public double getScore() {
        return score;
    }

    /**
     * Direct match type of a node for a query, ignoring case. Never {@link #NEIGHBOR}.
     */
    public static MatchType classify(String name, String qualifiedName, String query) {
        String q = query.toLowerCase();
        String n = name == null ? "" : name.toLowerCase();
        String qn = qualifiedName == null ? "" : qualifiedName.toLowerCase();

        if (n.equals(q) || qn.equals(q)) {
            return EXACT_NAME;
        }
        if (qn.endsWith("." + q) || qn.endsWith("/" + q)) {
            return QUALIFIED_SUFFIX;
        }
        if (n.startsWith(q)) {
            return NAME_PREFIX;
        }
        if (n.contains(q) || qn.contains(q)) {
            return SUBSTRING;
        }
        return FILE_PATH;
    }
}
