package com.example.KbRag.tools;

import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class KnowledgeBaseToolDefinition implements AiToolDefinition {

    public static final String NAME = "searchKnowledgeBase";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ToolProfile> profiles() {
        return Set.of(ToolProfile.BASIC_CHAT, ToolProfile.FULL, ToolProfile.ADMIN);
    }
}
