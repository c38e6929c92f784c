package com.example.KbRag.tools;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Weather lookups: the only tool of the weather agent, also offered in full and admin mode.
 */
@Component
@ConditionalOnProperty(prefix = "rag.weather", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WeatherToolDefinition implements AiToolDefinition {

    public static final String NAME = "getWeather";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ToolProfile> profiles() {
        return Set.of(ToolProfile.WEATHER, ToolProfile.FULL, ToolProfile.ADMIN);
    }
}
