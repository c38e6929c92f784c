package com.example.KbRag.model;

/**
 * Tagged result of one pipeline run.
 *
 * status      - PASSAGES, NO_RESULTS, OUT_OF_SCOPE or ERROR
 * query       - the query with normalized / expanded text filled in
 * results     - final ranked passages (empty unless status is PASSAGES)
 * maxSimilarity - best similarity seen after re-ranking, 0 when nothing was found
 * searchPath  - storage path that served the request
 * noiseFilterSkipped - true when every candidate looked like boilerplate and was kept anyway
 * message     - human readable message for non-PASSAGES outcomes
 */
public record RetrievalOutcome(
        Status status,
        Query query,
        RankedResultSet results,
        double maxSimilarity,
        SearchPath searchPath,
        boolean noiseFilterSkipped,
        String message
) {
    public enum Status {
        PASSAGES,
        NO_RESULTS,
        OUT_OF_SCOPE,
        ERROR
    }

    public RetrievalOutcome {
        results = results == null ? RankedResultSet.EMPTY : results;
    }

    public static RetrievalOutcome passages(Query query, RankedResultSet results, SearchPath path, boolean noiseFilterSkipped) {
        return new RetrievalOutcome(Status.PASSAGES, query, results, results.maxSimilarity(), path, noiseFilterSkipped, null);
    }

    public static RetrievalOutcome noResults(Query query, SearchPath path, String message) {
        return new RetrievalOutcome(Status.NO_RESULTS, query, RankedResultSet.EMPTY, 0.0, path, false, message);
    }

    public static RetrievalOutcome outOfScope(Query query, double maxSimilarity, SearchPath path, String message) {
        return new RetrievalOutcome(Status.OUT_OF_SCOPE, query, RankedResultSet.EMPTY, maxSimilarity, path, false, message);
    }

    public static RetrievalOutcome error(Query query, String message) {
        return new RetrievalOutcome(Status.ERROR, query, RankedResultSet.EMPTY, 0.0, SearchPath.UNAVAILABLE, false, message);
    }

    /**
     * Same outcome attributed to another request's query.
     */
    public RetrievalOutcome withQuery(Query other) {
        return new RetrievalOutcome(status, other, results, maxSimilarity, searchPath, noiseFilterSkipped, message);
    }

    public boolean hasPassages() {
        return status == Status.PASSAGES && !results.isEmpty();
    }
}
