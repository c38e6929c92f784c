package com.example.KbRag.config;

import com.example.KbRag.model.KbDocument;
import com.example.KbRag.model.RetrievalOutcome;
import com.example.KbRag.retrieval.LlmQueryExpander;
import com.example.KbRag.retrieval.NoOpQueryExpander;
import com.example.KbRag.retrieval.QueryExpander;
import com.example.KbRag.service.PromptLoader;
import com.example.KbRag.service.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RetrievalConfig {

    private static final Logger log = LoggerFactory.getLogger(RetrievalConfig.class);

    /**
     * Expansion uses its own client without the answering system prompt.
     * Falls back to the no-op expander when disabled or when no OpenAI model is configured.
     */
    @Bean
    public QueryExpander queryExpander(
            SearchProperties properties,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            PromptLoader promptLoader
    ) {
        SearchProperties.QueryExpansion settings = properties.getQueryExpansion();
        if (!settings.isEnabled()) {
            log.info("Query expansion disabled");
            return new NoOpQueryExpander();
        }

        OpenAiChatModel model = openAiProvider.getIfAvailable();
        if (model == null) {
            log.warn("Query expansion enabled but no OpenAI chat model is configured, expansion disabled");
            return new NoOpQueryExpander();
        }

        String template = promptLoader.load(settings.getPromptLocation(), LlmQueryExpander.DEFAULT_PROMPT);
        return new LlmQueryExpander(ChatClient.builder(model).build(), template, settings);
    }

    @Bean
    public ResultCache<String, RetrievalOutcome> queryResultCache(SearchProperties properties) {
        return new ResultCache<>("query-results", properties.getResultCacheTtl(), properties.getResultCacheSize());
    }

    @Bean
    public ResultCache<String, KbDocument> documentCache(SearchProperties properties) {
        return new ResultCache<>("documents", properties.getDocumentCacheTtl(), properties.getDocumentCacheSize());
    }

    @Bean
    public ResultCache<String, float[]> embeddingCache(EmbeddingProperties properties) {
        return new ResultCache<>("query-embeddings", properties.getCacheTtl(), properties.getCacheSize());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
