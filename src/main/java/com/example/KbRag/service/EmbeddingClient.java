package com.example.KbRag.service;

import com.example.KbRag.config.EmbeddingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wraps the embedding model with retry, truncation and a query cache.
 *
 * Rate limits and transient provider errors are retried with exponential backoff;
 * credential and configuration errors fail on the first attempt.
 */
@Service
public class EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingModel embeddingModel;
    private final EmbeddingProperties properties;
    private final ResultCache<String, float[]> cache;

    public EmbeddingClient(
            EmbeddingModel embeddingModel,
            EmbeddingProperties properties,
            @Qualifier("embeddingCache") ResultCache<String, float[]> cache
    ) {
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.cache = cache;
    }

    /**
     * Embeds a single query text, served from the cache when the same text was embedded recently.
     *
     * @throws EmbeddingException when the provider keeps failing or rejects the request
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed empty text");
        }
        String input = truncate(text);

        // callers get their own copy, the cached array is shared
        float[] vector = cache.get(input).orElseGet(() -> {
            float[] embedded = withRetry(Mono.fromCallable(() -> embeddingModel.embed(input)), "query");
            cache.put(input, embedded.clone());
            return embedded;
        });
        return vector.clone();
    }

    /**
     * Embeds texts in groups of {@code batch-size}. Output has the same size and order as the input.
     * Blank texts and texts that fail even one at a time map to zero vectors.
     */
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        int batchSize = Math.max(1, properties.getBatchSize());
        List<float[]> result = new ArrayList<>(texts.size());

        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> group = texts.subList(start, Math.min(start + batchSize, texts.size()));
            result.addAll(embedGroup(group, start / batchSize + 1));
        }
        return result;
    }

    private List<float[]> embedGroup(List<String> group, int groupNumber) {
        List<Integer> positions = new ArrayList<>();
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < group.size(); i++) {
            String text = group.get(i);
            if (text != null && !text.isBlank()) {
                positions.add(i);
                inputs.add(truncate(text));
            }
        }

        float[][] vectors = new float[group.size()][];
        if (!inputs.isEmpty()) {
            try {
                List<float[]> embedded = withRetry(Mono.fromCallable(() -> embeddingModel.embed(inputs)), "batch " + groupNumber);
                if (embedded.size() != inputs.size()) {
                    throw new IllegalStateException("Provider returned " + embedded.size()
                            + " vectors for " + inputs.size() + " texts");
                }
                for (int i = 0; i < positions.size(); i++) {
                    vectors[positions.get(i)] = embedded.get(i);
                }
            } catch (RuntimeException e) {
                log.warn("Batch {} failed ({}), embedding its {} texts one at a time",
                        groupNumber, e.getMessage(), inputs.size());
                for (int i = 0; i < positions.size(); i++) {
                    vectors[positions.get(i)] = embedSingleOrZero(inputs.get(i), groupNumber);
                }
            }
        }

        List<float[]> result = new ArrayList<>(group.size());
        for (float[] vector : vectors) {
            result.add(vector == null ? zeroVector() : vector);
        }
        return result;
    }

    private float[] embedSingleOrZero(String input, int groupNumber) {
        try {
            return withRetry(Mono.fromCallable(() -> embeddingModel.embed(input)), "item of batch " + groupNumber);
        } catch (RuntimeException e) {
            log.error("Could not embed text of {} chars in batch {}, using zero vector: {}",
                    input.length(), groupNumber, e.getMessage());
            return zeroVector();
        }
    }

    private <T> T withRetry(Mono<T> call, String what) {
        Retry retry = Retry.backoff(properties.getMaxRetries(), properties.getRetryDelay())
                .filter(EmbeddingClient::isRetryable)
                .doBeforeRetry(signal -> log.warn("Embedding {} failed ({}), retry {}/{}",
                        what, signal.failure().getMessage(), signal.totalRetries() + 1, properties.getMaxRetries()))
                .onRetryExhaustedThrow((spec, signal) -> new EmbeddingException(
                        "Embedding " + what + " failed after " + properties.getMaxRetries() + " retries",
                        signal.failure(),
                        isRateLimited(signal.failure())));

        try {
            return call.retryWhen(retry).block();
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new EmbeddingException(
                    "Embedding " + what + " rejected: " + cause.getMessage(), cause, isRateLimited(cause));
        }
    }

    static boolean isRetryable(Throwable error) {
        return isRateLimited(error)
                || error instanceof TransientAiException
                || error instanceof ResourceAccessException;
    }

    static boolean isRateLimited(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpClientErrorException.TooManyRequests) {
                return true;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("429") || lower.contains("rate limit") || lower.contains("rate_limit")) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private String truncate(String text) {
        int max = properties.getMaxInputChars();
        if (text.length() <= max) {
            return text;
        }
        log.debug("Truncating text of {} chars to {}", text.length(), max);
        return text.substring(0, max);
    }

    private float[] zeroVector() {
        return new float[properties.getDimensions()];
    }
}
