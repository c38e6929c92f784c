package com.example.KbRag.tools;

import com.example.KbRag.model.RetrievalOutcome;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-request holder for what the search tool found, passed to the tool through the ToolContext.
 * Only the last search counts: citation numbers refer to the context the model saw most recently.
 */
public class RetrievalSession {

    public static final String CONTEXT_KEY = "retrievalSession";

    private final AtomicReference<RetrievalOutcome> lastOutcome = new AtomicReference<>();
    private final AtomicInteger searchCount = new AtomicInteger();

    public void record(RetrievalOutcome outcome) {
        lastOutcome.set(outcome);
        searchCount.incrementAndGet();
    }

    public Optional<RetrievalOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    public int searchCount() {
        return searchCount.get();
    }
}
