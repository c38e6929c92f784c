package com.example.KbRag.tools;

/**
 * Groups of tools a chat request may enable.
 */
public enum ToolProfile {
    BASIC_CHAT,
    WEATHER,
    FULL,
    ADMIN
}
