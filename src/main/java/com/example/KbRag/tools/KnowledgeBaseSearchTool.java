package com.example.KbRag.tools;

import com.example.KbRag.config.SearchProperties;
import com.example.KbRag.model.Query;
import com.example.KbRag.model.RetrievalOutcome;
import com.example.KbRag.service.RagRetrievalService;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.context.annotation.Description;
import org.springframework.stereotype.Component;

import java.util.function.BiFunction;

/**
 * Knowledge-base search exposed to the chat model as a tool.
 * The outcome is also recorded in the request's {@link RetrievalSession} so sources
 * and citations can be resolved once the answer is complete.
 */
@Component(KnowledgeBaseToolDefinition.NAME)
@Description("""
        Recherche dans la base de connaissances documentaire. Utilise cet outil pour toute question
        portant sur le contenu des documents. Le résultat contient des extraits numérotés [1], [2]...
        à citer dans la réponse, ou un message HORS PÉRIMÈTRE / PERTINENCE FAIBLE si rien ne répond.
        """)
@RequiredArgsConstructor
public class KnowledgeBaseSearchTool
        implements BiFunction<KnowledgeBaseSearchTool.Request, ToolContext, KnowledgeBaseSearchTool.Response> {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseSearchTool.class);

    static final String SEARCH_ERROR_MESSAGE =
            "Erreur lors de la recherche dans la base de connaissances. Réessayez plus tard.";

    private final RagRetrievalService retrievalService;
    private final SearchProperties properties;

    public record Request(
            @JsonPropertyDescription("Question ou mots-clés à rechercher, en français")
            String query
    ) {
    }

    public record Response(String result) {
    }

    @Override
    public Response apply(Request request, ToolContext toolContext) {
        if (request == null || request.query() == null || request.query().isBlank()) {
            return new Response("Requête de recherche vide.");
        }

        try {
            Query query = Query.of(request.query(), properties.getDefaultLimit(), null);
            RetrievalOutcome outcome = retrievalService.retrieve(query);

            RetrievalSession session = sessionFrom(toolContext);
            if (session != null) {
                session.record(outcome);
            }

            log.info("Knowledge base tool: status={}, passages={}", outcome.status(), outcome.results().size());
            return new Response(retrievalService.formatContext(outcome));
        } catch (RuntimeException e) {
            log.error("Knowledge base tool failed for query '{}'", request.query(), e);
            return new Response(SEARCH_ERROR_MESSAGE);
        }
    }

    private static RetrievalSession sessionFrom(ToolContext toolContext) {
        if (toolContext == null || toolContext.getContext() == null) {
            return null;
        }
        Object value = toolContext.getContext().get(RetrievalSession.CONTEXT_KEY);
        return value instanceof RetrievalSession session ? session : null;
    }
}
