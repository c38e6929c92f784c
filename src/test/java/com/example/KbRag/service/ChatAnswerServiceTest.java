package com.example.KbRag.service;

import com.example.KbRag.config.ChatProperties;
import com.example.KbRag.config.WeatherProperties;
import com.example.KbRag.model.ChatAnswer;
import com.example.KbRag.model.ChatRequest;
import com.example.KbRag.model.Query;
import com.example.KbRag.model.RankedResultSet;
import com.example.KbRag.model.RetrievalOutcome;
import com.example.KbRag.model.RetrievedPassage;
import com.example.KbRag.model.SearchPath;
import com.example.KbRag.model.SourceDescriptor;
import com.example.KbRag.retrieval.CitationTracker;
import com.example.KbRag.tools.KnowledgeBaseToolDefinition;
import com.example.KbRag.tools.RetrievalSession;
import com.example.KbRag.tools.ToolRegistry;
import com.example.KbRag.tools.WeatherToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatAnswerServiceTest {

    @Mock
    private ChatClient deepseekClient;

    @Mock
    private ChatClient openaiClient;

    @Mock
    private ChatClient.CallResponseSpec callResponse;

    @Mock
    private ChatClient.StreamResponseSpec streamResponse;

    @Mock
    private RagRetrievalService retrievalService;

    private ChatClient.ChatClientRequestSpec requestSpec;
    private final AtomicReference<Map<String, Object>> toolContext = new AtomicReference<>();

    private ChatProperties properties;
    private InMemoryChatMemoryStore memoryStore;
    private ChatAnswerService service;

    @BeforeEach
    void setUp() {
        requestSpec = mock(ChatClient.ChatClientRequestSpec.class, RETURNS_SELF);
        lenient().doAnswer(invocation -> {
            toolContext.set(invocation.getArgument(0));
            return requestSpec;
        }).when(requestSpec).toolContext(anyMap());

        lenient().when(deepseekClient.prompt()).thenReturn(requestSpec);
        lenient().when(retrievalService.toSources(any(), anyBoolean())).thenCallRealMethod();

        properties = new ChatProperties();
        memoryStore = new InMemoryChatMemoryStore(properties, Clock.systemUTC());
        service = new ChatAnswerService(
                Map.of("deepseekChatClient", deepseekClient, "openaiChatClient", openaiClient),
                memoryStore,
                new ToolRegistry(List.of(new KnowledgeBaseToolDefinition(), new WeatherToolDefinition())),
                new CitationTracker(),
                retrievalService,
                new AgentRouter(new PromptLoader(new DefaultResourceLoader()), new WeatherProperties()),
                properties
        );
    }

    private static RetrievalOutcome twoPassages() {
        RetrievedPassage typeB = RetrievedPassage.builder()
                .chunkId("b1").documentId("type-b").documentTitle("Chantier de type B")
                .documentSource("type-b.pdf").content("Un chantier de type B occupe le trottoir.")
                .similarity(0.71).build();
        RetrievedPassage typeD = RetrievedPassage.builder()
                .chunkId("d1").documentId("type-d").documentTitle("Chantier de type D")
                .documentSource("type-d.pdf").content("Un chantier de type D occupe la chaussée.")
                .similarity(0.64).build();
        return RetrievalOutcome.passages(
                Query.of("chantier de type D", 30, null),
                new RankedResultSet(List.of(typeB, typeD)),
                SearchPath.FUSED,
                false
        );
    }

    /** Simulates the model calling the search tool before it answers. */
    private void searchDuringGeneration(RetrievalOutcome outcome) {
        RetrievalSession session = (RetrievalSession) toolContext.get().get(RetrievalSession.CONTEXT_KEY);
        session.record(outcome);
    }

    @Test
    @DisplayName("Blocking answer resolves citations against the tool's last search")
    void answerResolvesCitations() {
        when(requestSpec.call()).thenReturn(callResponse);
        when(callResponse.content()).thenAnswer(invocation -> {
            searchDuringGeneration(twoPassages());
            return "Il occupe la chaussée [2]. Voir aussi [7] et [le guide](https://example.org).";
        });

        ChatAnswer answer = service.answer(new ChatRequest("C'est quoi un chantier de type D ?", "s1", null, null));

        assertThat(answer.status()).isEqualTo(RetrievalOutcome.Status.PASSAGES);
        assertThat(answer.sessionId()).isEqualTo("s1");
        assertThat(answer.sources()).extracting(SourceDescriptor::title)
                .containsExactly("Chantier de type B", "Chantier de type D");
        assertThat(answer.citedIndices()).containsExactly(2);
        assertThat(answer.citedSources()).extracting(SourceDescriptor::title).containsExactly("Chantier de type D");

        assertThat(memoryStore.loadHistory("s1", "deepseek")).hasSize(2);
        verify(requestSpec).toolNames(KnowledgeBaseToolDefinition.NAME);
    }

    @Test
    void answerWithoutSearchHasNoSources() {
        when(requestSpec.call()).thenReturn(callResponse);
        when(callResponse.content()).thenReturn("Bonjour ! Comment puis-je vous aider ?");

        ChatAnswer answer = service.answer(new ChatRequest("Bonjour", null, null, null));

        assertThat(answer.status()).isNull();
        assertThat(answer.sources()).isEmpty();
        assertThat(answer.citedIndices()).isEmpty();
        assertThat(answer.sessionId()).startsWith("temp-");
    }

    @Test
    void answerFailureIsReturnedAsErrorAndNotPersisted() {
        when(requestSpec.call()).thenThrow(new IllegalStateException("model unavailable"));

        ChatAnswer answer = service.answer(new ChatRequest("Question", "s1", null, null));

        assertThat(answer.status()).isEqualTo(RetrievalOutcome.Status.ERROR);
        assertThat(answer.answer()).isEqualTo(ChatAnswerService.GENERIC_ERROR_MESSAGE);
        assertThat(memoryStore.loadHistory("s1", "deepseek")).isEmpty();
    }

    @Test
    void requestedModelSelectsItsClient() {
        when(openaiClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);
        when(callResponse.content()).thenReturn("ok");

        service.answer(new ChatRequest("Question", "s1", "openai", null));

        verify(openaiClient).prompt();
        verify(deepseekClient, never()).prompt();
        assertThat(memoryStore.loadHistory("s1", "openai")).hasSize(2);
    }

    @Test
    void blankQuestionIsRejected() {
        assertThatThrownBy(() -> service.answer(new ChatRequest("  ", "s1", null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.streamAnswer(new ChatRequest(null, "s1", null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(deepseekClient);
    }

    @Test
    @DisplayName("Stream emits start, history, deltas, sources and done in order")
    void streamEmitsStagesInOrder() {
        when(requestSpec.stream()).thenReturn(streamResponse);
        when(streamResponse.content()).thenReturn(Flux.defer(() -> {
            searchDuringGeneration(twoPassages());
            return Flux.just("Il occupe ", "la chaussée [2].");
        }));

        StepVerifier.create(service.streamAnswer(new ChatRequest("Chantier de type D ?", "s2", null, null)))
                .assertNext(e -> assertThat(e.stage()).isEqualTo("start"))
                .assertNext(e -> assertThat(e.stage()).isEqualTo("history"))
                .assertNext(e -> assertThat(e.payload()).isEqualTo("Il occupe "))
                .assertNext(e -> assertThat(e.payload()).isEqualTo("la chaussée [2]."))
                .assertNext(e -> {
                    assertThat(e.stage()).isEqualTo("sources");
                    assertThat((List<?>) e.payload()).hasSize(2);
                })
                .assertNext(e -> {
                    assertThat(e.stage()).isEqualTo("done");
                    ChatAnswer answer = (ChatAnswer) e.payload();
                    assertThat(answer.answer()).isEqualTo("Il occupe la chaussée [2].");
                    assertThat(answer.citedIndices()).containsExactly(2);
                })
                .verifyComplete();

        assertThat(memoryStore.loadHistory("s2", "deepseek"))
                .extracting(ChatMemoryStore.StoredMessage::content)
                .containsExactly("Chantier de type D ?", "Il occupe la chaussée [2].");
    }

    @Test
    @DisplayName("A stalled model stream ends with an error event once the request budget is spent")
    void streamTimesOut() {
        properties.setRequestTimeout(Duration.ofMillis(200));
        when(requestSpec.stream()).thenReturn(streamResponse);
        when(streamResponse.content()).thenReturn(Flux.never());

        StepVerifier.create(service.streamAnswer(new ChatRequest("Question", "s3", null, null)))
                .assertNext(e -> assertThat(e.stage()).isEqualTo("start"))
                .assertNext(e -> assertThat(e.stage()).isEqualTo("history"))
                .assertNext(e -> {
                    assertThat(e.stage()).isEqualTo("error");
                    assertThat(e.message()).isEqualTo(ChatAnswerService.TIMEOUT_MESSAGE);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(memoryStore.loadHistory("s3", "deepseek")).isEmpty();
    }

    @Test
    void streamFailureBecomesErrorEvent() {
        when(requestSpec.stream()).thenReturn(streamResponse);
        when(streamResponse.content()).thenReturn(Flux.concat(
                Flux.just("Début"),
                Flux.error(new IllegalStateException("connection reset"))
        ));

        StepVerifier.create(service.streamAnswer(new ChatRequest("Question", "s4", null, null)))
                .expectNextMatches(e -> e.stage().equals("start"))
                .expectNextMatches(e -> e.stage().equals("history"))
                .expectNextMatches(e -> e.stage().equals("answer_delta"))
                .expectNextMatches(e -> e.stage().equals("error")
                        && e.message().equals(ChatAnswerService.GENERIC_ERROR_MESSAGE))
                .verifyComplete();
    }

    @Test
    void previousTurnsAreLoadedIntoHistoryEvent() {
        memoryStore.appendTurn("s5", "deepseek", "Première question", "Première réponse", false);
        when(requestSpec.stream()).thenReturn(streamResponse);
        when(streamResponse.content()).thenReturn(Flux.just("ok"));

        StepVerifier.create(service.streamAnswer(new ChatRequest("Suite", "s5", null, null)))
                .expectNextMatches(e -> e.stage().equals("start"))
                .assertNext(e -> assertThat((List<?>) e.payload()).hasSize(2))
                .expectNextCount(3)
                .verifyComplete();
    }

    @Test
    @DisplayName("A memory store failure before the model call still ends with an error event")
    void historyFailureBecomesErrorEvent() {
        ChatMemoryStore brokenStore = mock(ChatMemoryStore.class);
        when(brokenStore.loadHistory(anyString(), anyString())).thenThrow(new IllegalStateException("redis down"));
        ChatAnswerService brokenService = new ChatAnswerService(
                Map.of("deepseekChatClient", deepseekClient),
                brokenStore,
                new ToolRegistry(List.of(new KnowledgeBaseToolDefinition())),
                new CitationTracker(),
                retrievalService,
                new AgentRouter(new PromptLoader(new DefaultResourceLoader()), new WeatherProperties()),
                properties
        );

        StepVerifier.create(brokenService.streamAnswer(new ChatRequest("Question", "s6", null, null)))
                .assertNext(e -> {
                    assertThat(e.stage()).isEqualTo("error");
                    assertThat(e.message()).isEqualTo(ChatAnswerService.GENERIC_ERROR_MESSAGE);
                    assertThat(e.payload()).isEqualTo(Map.of("sessionId", "s6"));
                })
                .verifyComplete();

        ChatAnswer answer = brokenService.answer(new ChatRequest("Question", null, null, null));
        assertThat(answer.status()).isEqualTo(RetrievalOutcome.Status.ERROR);
        assertThat(answer.answer()).isEqualTo(ChatAnswerService.GENERIC_ERROR_MESSAGE);
    }

    @Test
    @DisplayName("@weather mention switches to the weather agent for that turn")
    void weatherMentionRoutesToWeatherAgent() {
        when(requestSpec.call()).thenReturn(callResponse);
        when(callResponse.content()).thenReturn("Il fait 12°C à Bruxelles (source : Open-Meteo).");

        ChatAnswer answer = service.answer(new ChatRequest("@weather Météo à Bruxelles ?", "s7", null, null));

        verify(requestSpec).system(contains("météo"));
        verify(requestSpec).toolNames(WeatherToolDefinition.NAME);
        verify(requestSpec).user(endsWith("Question de l'utilisateur: Météo à Bruxelles ?"));
        assertThat(answer.sources()).isEmpty();
        assertThat(memoryStore.loadHistory("s7", "deepseek").get(0).content()).isEqualTo("@weather Météo à Bruxelles ?");
    }

    @Test
    void plainQuestionKeepsDefaultSystemPrompt() {
        when(requestSpec.call()).thenReturn(callResponse);
        when(callResponse.content()).thenReturn("ok");

        service.answer(new ChatRequest("Chantier de type D ?", "s8", null, null));

        verify(requestSpec, never()).system(anyString());
        verify(requestSpec).toolNames(KnowledgeBaseToolDefinition.NAME);
    }
}
