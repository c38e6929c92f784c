package com.example.KbRag.service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Conversation history per session.
 *
 * History is bound to the model that produced it: a turn stored under another model
 * clears the session first, and loading with another model returns nothing.
 */
public interface ChatMemoryStore {

    List<StoredMessage> loadHistory(String sessionId, String model);

    /**
     * Append one full turn (user + assistant), then trim the session to its window.
     */
    void appendTurn(String sessionId, String model, String userMessage, String assistantMessage, boolean temporary);

    void clear(String sessionId);

    /**
     * Render the last {@code maxMessages} messages as "role: content" lines for the prompt.
     */
    static String renderHistory(List<StoredMessage> messages, int maxMessages) {
        if (messages == null || messages.isEmpty()) {
            return "(aucun échange précédent)";
        }
        int startIdx = Math.max(0, messages.size() - maxMessages);
        return messages.subList(startIdx, messages.size()).stream()
                .map(m -> m.role() + ": " + m.content())
                .collect(Collectors.joining("\n"));
    }

    record StoredMessage(String role, String content, long timestamp) { }
}
