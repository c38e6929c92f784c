package com.example.KbRag.service;

import com.example.KbRag.config.EmbeddingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingClientTest {

    private static final float[] VECTOR = {0.1f, 0.2f, 0.3f};

    @Mock
    private EmbeddingModel embeddingModel;

    private EmbeddingProperties properties;
    private EmbeddingClient client;

    @BeforeEach
    void setUp() {
        properties = new EmbeddingProperties();
        properties.setRetryDelay(Duration.ofMillis(1));
        properties.setDimensions(3);
        properties.setBatchSize(2);
        client = new EmbeddingClient(embeddingModel, properties,
                new ResultCache<>("embeddings", Duration.ofHours(1), 200));
    }

    @Test
    @DisplayName("Identical query texts hit the model once")
    void embedUsesCache() {
        when(embeddingModel.embed("chantier de type d")).thenReturn(VECTOR);

        client.embed("chantier de type d");
        float[] second = client.embed("chantier de type d");

        assertArrayEquals(VECTOR, second);
        verify(embeddingModel, times(1)).embed("chantier de type d");
    }

    @Test
    void cachedVectorIsNotSharedWithCallers() {
        when(embeddingModel.embed("chantier de type d")).thenReturn(new float[]{0.1f, 0.2f, 0.3f});

        float[] first = client.embed("chantier de type d");
        first[0] = 42f;
        float[] second = client.embed("chantier de type d");

        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, second);
        verify(embeddingModel, times(1)).embed("chantier de type d");
    }

    @Test
    void rateLimitIsRetried() {
        when(embeddingModel.embed(anyString()))
                .thenThrow(new RuntimeException("HTTP 429 - Too Many Requests"))
                .thenReturn(VECTOR);

        assertArrayEquals(VECTOR, client.embed("question"));
        verify(embeddingModel, times(2)).embed(anyString());
    }

    @Test
    void transientErrorIsRetried() {
        when(embeddingModel.embed(anyString()))
                .thenThrow(new TransientAiException("503 Service Unavailable"))
                .thenReturn(VECTOR);

        assertArrayEquals(VECTOR, client.embed("question"));
    }

    @Test
    @DisplayName("Exhausted retries surface a rate-limited EmbeddingException")
    void rateLimitExhaustionIsDistinguishable() {
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("Rate limit reached for requests"));

        EmbeddingException ex = assertThrows(EmbeddingException.class, () -> client.embed("question"));

        assertTrue(ex.isRateLimited());
        verify(embeddingModel, times(properties.getMaxRetries() + 1)).embed(anyString());
    }

    @Test
    @DisplayName("Credential errors fail on the first attempt")
    void credentialErrorFailsFast() {
        when(embeddingModel.embed(anyString()))
                .thenThrow(new NonTransientAiException("401 - Incorrect API key provided"));

        EmbeddingException ex = assertThrows(EmbeddingException.class, () -> client.embed("question"));

        assertFalse(ex.isRateLimited());
        verify(embeddingModel, times(1)).embed(anyString());
    }

    @Test
    void longTextIsTruncated() {
        properties.setMaxInputChars(5);
        when(embeddingModel.embed("abcde")).thenReturn(VECTOR);

        assertArrayEquals(VECTOR, client.embed("abcdefghij"));
    }

    @Test
    void emptyTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> client.embed("  "));
        verify(embeddingModel, never()).embed(anyString());
    }

    @Test
    @DisplayName("Batches keep input order and map blank texts to zero vectors")
    void embedBatchGroupsAndPreservesOrder() {
        float[] a = {1f, 0f, 0f};
        float[] b = {0f, 1f, 0f};
        float[] c = {0f, 0f, 1f};
        when(embeddingModel.embed(List.of("a", "b"))).thenReturn(List.of(a, b));
        when(embeddingModel.embed(List.of("c"))).thenReturn(List.of(c));

        List<float[]> vectors = client.embedBatch(Arrays.asList("a", "b", " ", "c"));

        assertEquals(4, vectors.size());
        assertArrayEquals(a, vectors.get(0));
        assertArrayEquals(b, vectors.get(1));
        assertArrayEquals(new float[3], vectors.get(2));
        assertArrayEquals(c, vectors.get(3));
    }

    @Test
    @DisplayName("A failing group falls back to one-at-a-time and a bad item becomes a zero vector")
    void failedGroupFallsBackToSingleItems() {
        float[] good = {1f, 1f, 1f};
        when(embeddingModel.embed(anyList())).thenThrow(new IllegalArgumentException("invalid input"));
        when(embeddingModel.embed("good")).thenReturn(good);
        when(embeddingModel.embed("bad")).thenThrow(new IllegalArgumentException("invalid input"));

        List<float[]> vectors = client.embedBatch(List.of("good", "bad"));

        assertArrayEquals(good, vectors.get(0));
        assertArrayEquals(new float[3], vectors.get(1));
        verify(embeddingModel, times(1)).embed(eq("bad"));
    }

    @Test
    void emptyBatchReturnsEmptyList() {
        assertTrue(client.embedBatch(List.of()).isEmpty());
    }
}
