package com.example.KbRag.config;

import com.example.KbRag.service.PromptLoader;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    static final String DEFAULT_SYSTEM_PROMPT = """
            Tu es un assistant qui répond en français à partir d'une base de connaissances documentaire.
            Utilise l'outil searchKnowledgeBase avant de répondre à toute question sur les documents.
            Cite chaque information avec le numéro de sa source entre crochets, par exemple [1] ou [2].
            Si l'outil répond HORS PÉRIMÈTRE ou PERTINENCE FAIBLE, dis-le poliment sans inventer de réponse.""";

    private final String systemPrompt;

    public AiConfig(PromptLoader promptLoader, ChatProperties properties) {
        this.systemPrompt = promptLoader.load(properties.getSystemPromptLocation(), DEFAULT_SYSTEM_PROMPT);
    }

    /**
     * DeepSeek is the default ChatClient.
     * Only created when a DeepSeekChatModel bean exists, so a missing DeepSeek key does not stop the app.
     */
    @Bean
    @Primary
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(systemPrompt)
                .build();
    }

    @Bean
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(systemPrompt)
                .build();
    }

    /**
     * If neither conditional client was registered, build one from whichever model is available,
     * DeepSeek first.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel).defaultSystem(systemPrompt).build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).defaultSystem(systemPrompt).build();
        }

        throw new IllegalStateException(
                "No chat model is configured: set spring.ai.deepseek.api-key or spring.ai.openai.api-key");
    }
}
