package com.example.KbRag.service;

import com.example.KbRag.config.ChatProperties;
import com.example.KbRag.model.ChatAnswer;
import com.example.KbRag.model.ChatRequest;
import com.example.KbRag.model.RetrievalOutcome;
import com.example.KbRag.model.SourceDescriptor;
import com.example.KbRag.model.ThinkingEvent;
import com.example.KbRag.retrieval.CitationTracker;
import com.example.KbRag.tools.RetrievalSession;
import com.example.KbRag.tools.ToolProfile;
import com.example.KbRag.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Answers questions with the chat model, which searches the knowledge base through its tool.
 *
 * Each request gets its own {@link RetrievalSession}, handed to the tool via the ToolContext,
 * so concurrent requests never see each other's sources.
 */
@Service
public class ChatAnswerService {

    private static final Logger log = LoggerFactory.getLogger(ChatAnswerService.class);

    static final String GENERIC_ERROR_MESSAGE =
            "Une erreur est survenue lors de la génération de la réponse. Veuillez réessayer.";

    static final String TIMEOUT_MESSAGE =
            "La génération de la réponse a dépassé le délai autorisé. Veuillez réessayer.";

    private final Map<String, ChatClient> chatClients;
    private final ChatMemoryStore memoryStore;
    private final ToolRegistry toolRegistry;
    private final CitationTracker citationTracker;
    private final RagRetrievalService retrievalService;
    private final AgentRouter agentRouter;
    private final ChatProperties properties;

    public ChatAnswerService(
            Map<String, ChatClient> chatClients,
            ChatMemoryStore memoryStore,
            ToolRegistry toolRegistry,
            CitationTracker citationTracker,
            RagRetrievalService retrievalService,
            AgentRouter agentRouter,
            ChatProperties properties
    ) {
        this.chatClients = chatClients;
        this.memoryStore = memoryStore;
        this.toolRegistry = toolRegistry;
        this.citationTracker = citationTracker;
        this.retrievalService = retrievalService;
        this.agentRouter = agentRouter;
        this.properties = properties;
    }

    /**
     * Blocking answer. Timeouts and model failures come back as an ERROR answer, never as exceptions.
     *
     * @throws IllegalArgumentException when the question is empty
     */
    public ChatAnswer answer(ChatRequest request) {
        validate(request);

        Turn turn;
        try {
            turn = openTurn(request);
        } catch (RuntimeException e) {
            log.error("Chat turn could not start (session={})", fallbackSessionId(request), e);
            return new ChatAnswer(GENERIC_ERROR_MESSAGE, fallbackSessionId(request),
                    RetrievalOutcome.Status.ERROR, List.of(), Set.of());
        }

        try {
            String text = Mono.fromCallable(() -> turn.spec().call().content())
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(properties.getRequestTimeout())
                    .block();
            return complete(turn, text == null ? "" : text);
        } catch (RuntimeException e) {
            return failure(turn, Exceptions.unwrap(e));
        }
    }

    /**
     * Streaming answer with stages:
     *  - "start": request accepted
     *  - "history": previous conversation loaded
     *  - "answer_delta": model token stream
     *  - "sources": sources of the last knowledge-base search
     *  - "done": final answer with cited indices
     *  - "error": timeout or failure; the stream completes right after
     */
    public Flux<ThinkingEvent> streamAnswer(ChatRequest request) {
        validate(request);

        return Flux.defer(() -> {
            Turn turn = openTurn(request);
            StringBuilder aggregate = new StringBuilder();

            Flux<ThinkingEvent> startStep = Flux.just(new ThinkingEvent(
                    "start",
                    "Requête reçue.",
                    Map.of("sessionId", turn.sessionId(), "model", turn.model(), "agent", turn.agent(),
                            "ts", System.currentTimeMillis())
            ));

            Flux<ThinkingEvent> historyStep = Flux.just(new ThinkingEvent(
                    "history",
                    "Historique de la conversation chargé.",
                    summarizeHistory(turn.history())
            ));

            Flux<ThinkingEvent> answerDeltaStep = turn.spec()
                    .stream()
                    .content()
                    .map(delta -> {
                        aggregate.append(delta);
                        return new ThinkingEvent("answer_delta", "Génération de la réponse.", delta);
                    });

            Flux<ThinkingEvent> finalSteps = Flux.defer(() -> {
                ChatAnswer answer = complete(turn, aggregate.toString());
                return Flux.just(
                        new ThinkingEvent("sources", "Sources de la dernière recherche.", answer.sources()),
                        new ThinkingEvent("done", "Réponse terminée.", answer)
                );
            });

            // one absolute deadline for the whole stream, not a per-item gap
            Mono<Long> deadline = Mono.delay(properties.getRequestTimeout()).cache();

            return Flux.concat(startStep, historyStep, answerDeltaStep, finalSteps)
                    .timeout(deadline, event -> deadline)
                    .onErrorResume(e -> {
                        ChatAnswer failed = failure(turn, e);
                        return Flux.just(new ThinkingEvent("error", failed.answer(), Map.of("sessionId", turn.sessionId())));
                    });
        }).onErrorResume(e -> {
            // the turn could not be opened (memory store or client lookup failed), no session resolved yet
            String sessionId = fallbackSessionId(request);
            log.error("Chat turn could not start (session={})", sessionId, e);
            return Flux.just(new ThinkingEvent("error", GENERIC_ERROR_MESSAGE, Map.of("sessionId", sessionId)));
        });
    }

    private void validate(ChatRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
    }

    private static String fallbackSessionId(ChatRequest request) {
        return request.sessionId() == null || request.sessionId().isBlank() ? "" : request.sessionId();
    }

    private Turn openTurn(ChatRequest request) {
        ChatRequest.ResolvedSession session = request.resolveSession();
        String model = request.resolveModel(properties.getDefaultModel());
        ChatClient chatClient = resolveClient(model);

        List<ChatMemoryStore.StoredMessage> history = memoryStore.loadHistory(session.id(), model);

        AgentRouter.Route route = agentRouter.route(request.question());
        AgentRouter.Agent agent = route.agent();
        ToolProfile profile = agent.toolProfile() != null
                ? agent.toolProfile()
                : request.resolveToolProfile(ToolProfile.BASIC_CHAT);
        String[] toolNames = toolRegistry.getFunctionBeanNamesForProfile(profile).toArray(String[]::new);

        RetrievalSession retrieval = new RetrievalSession();
        String prompt = buildPrompt(route.question(), ChatMemoryStore.renderHistory(history, properties.getMaxMessagesInPrompt()));

        ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
        if (agent.systemPrompt() != null) {
            spec = spec.system(agent.systemPrompt());
        }
        spec = spec
                .user(prompt)
                .toolNames(toolNames)
                .toolContext(Map.of(RetrievalSession.CONTEXT_KEY, retrieval));

        log.info("Chat turn: session={}, model={}, agent={}, profile={}, history={} messages",
                session.id(), model, agent.id(), profile, history.size());
        return new Turn(request.question(), session.id(), session.temporary(), model, agent.id(), history, retrieval, spec);
    }

    /**
     * Resolves citations against the last search, then persists the turn.
     */
    private ChatAnswer complete(Turn turn, String text) {
        Optional<RetrievalOutcome> last = turn.retrieval().lastOutcome();
        List<SourceDescriptor> sources = last
                .map(outcome -> retrievalService.toSources(outcome, true))
                .orElse(List.of());
        Set<Integer> cited = citationTracker.withinRange(citationTracker.extractCitedIndices(text), sources.size());

        memoryStore.appendTurn(turn.sessionId(), turn.model(), turn.question(), text, turn.temporary());

        log.info("Answer for session {}: {} chars, {} sources, cited {}",
                turn.sessionId(), text.length(), sources.size(), cited);
        return new ChatAnswer(text, turn.sessionId(), last.map(RetrievalOutcome::status).orElse(null), sources, cited);
    }

    private ChatAnswer failure(Turn turn, Throwable error) {
        String message;
        if (error instanceof TimeoutException) {
            log.warn("Chat turn timed out after {} (session={}, model={})",
                    properties.getRequestTimeout(), turn.sessionId(), turn.model());
            message = TIMEOUT_MESSAGE;
        } else {
            log.error("Chat turn failed (session={}, model={}, question='{}')",
                    turn.sessionId(), turn.model(), turn.question(), error);
            message = GENERIC_ERROR_MESSAGE;
        }
        return new ChatAnswer(message, turn.sessionId(), RetrievalOutcome.Status.ERROR, List.of(), Set.of());
    }

    /**
     * Resolve ChatClient bean based on the model identifier.
     * Supported lookup keys:
     *  - "<model>ChatClient"
     *  - "<model>"
     * Fallback: the default model's client, then any available client.
     */
    private ChatClient resolveClient(String model) {
        if (chatClients.containsKey(model + "ChatClient")) {
            return chatClients.get(model + "ChatClient");
        }
        if (chatClients.containsKey(model)) {
            return chatClients.get(model);
        }
        ChatClient fallback = chatClients.get(properties.getDefaultModel() + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }

    private static String buildPrompt(String question, String historyText) {
        return "Historique de la conversation:\n" + historyText + "\n\n"
                + "Question de l'utilisateur: " + question;
    }

    /**
     * Role and a short preview of each message, for the "history" event.
     */
    private static List<Map<String, Object>> summarizeHistory(List<ChatMemoryStore.StoredMessage> history) {
        return history.stream()
                .map(m -> Map.<String, Object>of(
                        "role", m.role(),
                        "content", preview(m.content())
                ))
                .toList();
    }

    private static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > 200 ? content.substring(0, 200) + "..." : content;
    }

    private record Turn(
            String question,
            String sessionId,
            boolean temporary,
            String model,
            String agent,
            List<ChatMemoryStore.StoredMessage> history,
            RetrievalSession retrieval,
            ChatClient.ChatClientRequestSpec spec
    ) {
    }
}
