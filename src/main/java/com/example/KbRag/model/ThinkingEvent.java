package com.example.KbRag.model;

/**
 * A single step event streamed to the client.
 *
 * stage   - pipeline stage name: "start", "history", "answer_delta", "sources", "done", "error"
 * message - human-readable description of what this step means
 * payload - stage specific payload, e.g.:
 *           - List<Map<...>> for history summaries
 *           - String for answer token delta
 *           - ChatAnswer for the final sources / cited indices
 */
public record ThinkingEvent(
        String stage,
        String message,
        Object payload
) {
}
