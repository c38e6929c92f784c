package com.example.KbRag.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads prompt templates from "classpath:" or "file:" locations,
 * falling back to a built-in default when the resource is missing or unreadable.
 */
@Component
@RequiredArgsConstructor
public class PromptLoader {

    private static final Logger log = LoggerFactory.getLogger(PromptLoader.class);

    private final ResourceLoader resourceLoader;

    public String load(String location, String fallback) {
        if (location == null || location.isBlank()) {
            return fallback;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.info("Prompt '{}' not found, using built-in default", location);
            return fallback;
        }
        try {
            String text = resource.getContentAsString(StandardCharsets.UTF_8);
            if (text.isBlank()) {
                log.warn("Prompt '{}' is empty, using built-in default", location);
                return fallback;
            }
            log.info("Loaded prompt from {}", location);
            return text;
        } catch (IOException e) {
            log.warn("Failed to read prompt '{}': {}", location, e.getMessage());
            return fallback;
        }
    }
}
