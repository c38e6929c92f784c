package com.example.KbRag.model;

import java.util.List;

/**
 * Pure retrieval result for RAG:
 * - question: original user question
 * - normalizedQuery: question after interrogative stripping
 * - status: pipeline outcome (PASSAGES, NO_RESULTS, OUT_OF_SCOPE, ERROR)
 * - sources: ranked sources, empty unless status is PASSAGES
 * - context: numbered context string for LLM prompts, or the refusal message
 */
public record RagRetrievalResult(
        String question,
        String normalizedQuery,
        RetrievalOutcome.Status status,
        List<SourceDescriptor> sources,
        String context
) {}
