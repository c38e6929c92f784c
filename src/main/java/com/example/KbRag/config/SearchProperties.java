package com.example.KbRag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retrieval tuning, bound from {@code rag.search.*}.
 */
@Data
@ConfigurationProperties(prefix = "rag.search")
public class SearchProperties {

    private int defaultLimit = 30;
    private int maxLimit = 100;

    /** Passages below this similarity are never returned. */
    private double similarityThreshold = 0.25;

    /** When the best passage stays below this after re-ranking, the question is refused. */
    private double outOfScopeThreshold = 0.40;

    private int maxChunksPerDocument = 5;

    /** Reciprocal Rank Fusion damping constant; lower favours top-ranked results. */
    private int rrfK = 50;

    private boolean excludeBoilerplate = true;

    /** Share of lines ending in a page number above which a chunk counts as a table of contents. */
    private double noiseLineRatio = 0.4;

    /** Upper bound for expansion + embedding of one query. */
    private Duration timeout = Duration.ofSeconds(30);

    private Duration resultCacheTtl = Duration.ofSeconds(60);
    private long resultCacheSize = 100;
    private Duration documentCacheTtl = Duration.ofSeconds(300);
    private long documentCacheSize = 500;

    private TitleRerank titleRerank = new TitleRerank();
    private QueryExpansion queryExpansion = new QueryExpansion();

    @Data
    public static class TitleRerank {
        private boolean enabled = true;
        private double boost = 0.15;
        private List<String> classifiers = new ArrayList<>(
                List.of("type", "classe", "categorie", "niveau", "phase", "etape", "version"));
    }

    @Data
    public static class QueryExpansion {
        private boolean enabled = true;
        private String model = "gpt-4o-mini";
        private String promptLocation = "classpath:prompts/query_expansion.txt";
        private int maxTokens = 100;
        private double temperature = 0.3;
    }
}
