package com.example.KbRag.tools;

import java.util.Set;

/**
 * Metadata for a tool the chat model may call.
 * The callable itself is a separate Spring bean registered under {@link #functionBeanName()}.
 */
public interface AiToolDefinition {

    /**
     * Unique tool name, passed to ChatClient.toolNames(...)
     */
    String name();

    /**
     * Profiles in which the model may use this tool.
     */
    Set<ToolProfile> profiles();

    default String functionBeanName() {
        return name();
    }
}
