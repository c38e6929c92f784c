package com.example.KbRag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "rag.chat")
public class ChatProperties {

    /** Whole-request budget for retrieval plus model streaming. */
    private Duration requestTimeout = Duration.ofSeconds(60);

    /** "memory" (in-process) or "redis". */
    private String memoryStore = "memory";

    private Duration sessionTtl = Duration.ofHours(1);
    private int maxMessages = 10;
    private int maxMessagesInPrompt = 8;

    private String defaultModel = "deepseek";
    private String systemPromptLocation = "classpath:prompts/system_prompt.txt";
}
