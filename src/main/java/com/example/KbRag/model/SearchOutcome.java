package com.example.KbRag.model;

import java.util.List;

/**
 * Result of the search gateway, carrying the path that produced it.
 * {@code failure} is set only when {@code path} is {@link SearchPath#UNAVAILABLE}.
 */
public record SearchOutcome(
        List<RetrievedPassage> passages,
        SearchPath path,
        Throwable failure
) {
    public SearchOutcome {
        passages = passages == null ? List.of() : List.copyOf(passages);
    }

    public static SearchOutcome fused(List<RetrievedPassage> passages) {
        return new SearchOutcome(passages, SearchPath.FUSED, null);
    }

    public static SearchOutcome vectorFallback(List<RetrievedPassage> passages) {
        return new SearchOutcome(passages, SearchPath.VECTOR_FALLBACK, null);
    }

    public static SearchOutcome unavailable(Throwable failure) {
        return new SearchOutcome(List.of(), SearchPath.UNAVAILABLE, failure);
    }

    public boolean isAvailable() {
        return path != SearchPath.UNAVAILABLE;
    }
}
