package com.example.KbRag.tools;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Knows every tool definition and which profile enables it.
 */
@Component
public class ToolRegistry {

    private final Map<String, AiToolDefinition> toolsByName;
    private final Map<ToolProfile, List<AiToolDefinition>> toolsByProfile;

    public ToolRegistry(List<AiToolDefinition> definitions) {
        this.toolsByName = definitions.stream()
                .collect(Collectors.toUnmodifiableMap(AiToolDefinition::name, d -> d));

        Map<ToolProfile, List<AiToolDefinition>> byProfile = new EnumMap<>(ToolProfile.class);
        for (AiToolDefinition def : definitions) {
            for (ToolProfile profile : def.profiles()) {
                byProfile.computeIfAbsent(profile, p -> new ArrayList<>()).add(def);
            }
        }
        this.toolsByProfile = Collections.unmodifiableMap(byProfile);
    }

    public List<AiToolDefinition> getToolsForProfile(ToolProfile profile) {
        return toolsByProfile.getOrDefault(profile, List.of());
    }

    /**
     * Bean names to hand to ChatClient.toolNames(...) for this profile.
     */
    public List<String> getFunctionBeanNamesForProfile(ToolProfile profile) {
        return getToolsForProfile(profile).stream()
                .map(AiToolDefinition::functionBeanName)
                .toList();
    }

    public Optional<AiToolDefinition> findByName(String name) {
        return Optional.ofNullable(toolsByName.get(name));
    }
}
