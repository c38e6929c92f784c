package com.example.KbRag.retrieval;

import com.example.KbRag.model.RetrievedPassage;

import java.util.List;

/**
 * Verdict of the scope guard. {@code passages} is the input list, untouched, when in scope.
 */
public record ScopeDecision(Verdict verdict, double maxSimilarity, List<RetrievedPassage> passages) {

    public enum Verdict {
        NO_RESULTS,
        OUT_OF_SCOPE,
        IN_SCOPE
    }
}
