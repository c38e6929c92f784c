package com.example.KbRag.model;

import com.example.KbRag.tools.ToolProfile;

import java.util.Set;

/**
 * Request payload for generating an answer over the knowledge base.
 *
 * @param question     user question
 * @param sessionId    chat session id for memory separation
 * @param model        optional model name hint ("deepseek", "openai")
 * @param toolProfile  optional tool profile ("BASIC_CHAT", "ADMIN", "FULL")
 */
public record ChatRequest(
        String question,
        String sessionId,
        String model,
        String toolProfile
) {
    private static final Set<String> models = Set.of("deepseek", "openai");

    public String resolveModel(String defaultModel) {
        return (model == null || model.isBlank()
        || !models.contains(model)) ? defaultModel : model;
    }

    public ResolvedSession resolveSession() {
        boolean temporary = sessionId == null || sessionId.isBlank();
        String resolvedId = temporary ? "temp-" + java.util.UUID.randomUUID() : sessionId;
        return new ResolvedSession(resolvedId, temporary);
    }

    /**
     * Resolve the tool profile for this request.
     * If toolProfile is null/blank/invalid, fall back to provided defaultProfile.
     */
    public ToolProfile resolveToolProfile(ToolProfile defaultProfile) {
        if (toolProfile == null || toolProfile.isBlank()) {
            return defaultProfile;
        }
        try {
            // Accept strings like "basic_chat", "BASIC_CHAT", "basic chat" etc.
            String normalized = toolProfile
                    .trim()
                    .replace(' ', '_')
                    .toUpperCase();
            return ToolProfile.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return defaultProfile;
        }
    }

    public record ResolvedSession(String id, boolean temporary) { }
}
