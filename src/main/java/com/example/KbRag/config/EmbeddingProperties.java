package com.example.KbRag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "rag.embedding")
public class EmbeddingProperties {

    private int batchSize = 100;
    private int maxRetries = 3;

    /** Base delay, doubled on every rate-limited attempt. */
    private Duration retryDelay = Duration.ofSeconds(1);

    /** Size of the zero vector used for texts that cannot be embedded. */
    private int dimensions = 1536;

    /** Roughly 8191 tokens at four characters per token. */
    private int maxInputChars = 8191 * 4;

    private Duration cacheTtl = Duration.ofHours(1);
    private long cacheSize = 200;
}
