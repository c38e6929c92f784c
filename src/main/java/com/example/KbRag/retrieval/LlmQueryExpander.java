package com.example.KbRag.retrieval;

import com.example.KbRag.config.SearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.PromptTemplate;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Asks a language model for synonyms and technical terms and appends them to the query.
 * The prompt template comes from a configurable resource and must contain a {query} placeholder.
 */
public class LlmQueryExpander implements QueryExpander {

    private static final Logger log = LoggerFactory.getLogger(LlmQueryExpander.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final String DEFAULT_PROMPT = """
            You are a query reformulation assistant for document retrieval.

            Reformulate the following question by adding relevant synonyms and technical terms.
            Keep the reformulation concise (max 40 words) on a single line.
            Do not add question marks or formatting.

            Question: {query}

            Enriched reformulation:""";

    private final ChatClient chatClient;
    private final String promptTemplate;
    private final ChatOptions options;

    public LlmQueryExpander(ChatClient chatClient, String promptTemplate, SearchProperties.QueryExpansion settings) {
        this.chatClient = chatClient;
        this.promptTemplate = promptTemplate == null || promptTemplate.isBlank() ? DEFAULT_PROMPT : promptTemplate;
        this.options = ChatOptions.builder()
                .model(settings.getModel())
                .maxTokens(settings.getMaxTokens())
                .temperature(settings.getTemperature())
                .build();
    }

    @Override
    public String expand(String query) {
        if (query == null || query.isBlank()) {
            return query;
        }
        try {
            String prompt = new PromptTemplate(promptTemplate).render(Map.of("query", query));

            String expansion = chatClient.prompt()
                    .options(options)
                    .user(prompt)
                    .call()
                    .content();

            if (expansion == null || expansion.isBlank()) {
                log.warn("Query expansion returned an empty response, using original query");
                return query;
            }

            String cleaned = WHITESPACE.matcher(expansion.strip()).replaceAll(" ");
            log.info("Query expansion: '{}' -> +{} chars", abbreviate(query), cleaned.length());
            return query + " " + cleaned;
        } catch (Exception e) {
            log.warn("Query expansion failed, using original query: {}", e.getMessage());
            return query;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
