package com.example.KbRag.model;

import java.util.List;
import java.util.Set;

/**
 * Final answer returned to the caller.
 *
 * @param answer        generated text, or a refusal / error message
 * @param sessionId     session the turn was stored under
 * @param status        outcome of the last knowledge-base search, null when the model never searched
 * @param sources       sources from the last search, in the order they were shown to the model
 * @param citedIndices  1-based indices the answer actually cites, restricted to [1, sources.size()]
 */
public record ChatAnswer(
        String answer,
        String sessionId,
        RetrievalOutcome.Status status,
        List<SourceDescriptor> sources,
        Set<Integer> citedIndices
) {
    public List<SourceDescriptor> citedSources() {
        return sources.stream()
                .filter(s -> citedIndices.contains(s.index()))
                .toList();
    }
}
