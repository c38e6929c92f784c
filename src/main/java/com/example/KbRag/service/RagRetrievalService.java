package com.example.KbRag.service;

import com.example.KbRag.config.SearchProperties;
import com.example.KbRag.model.HybridSearchRequest;
import com.example.KbRag.model.Query;
import com.example.KbRag.model.RagQueryRequest;
import com.example.KbRag.model.RagRetrievalResult;
import com.example.KbRag.model.RankedResultSet;
import com.example.KbRag.model.RetrievalOutcome;
import com.example.KbRag.model.RetrievedPassage;
import com.example.KbRag.model.SearchOutcome;
import com.example.KbRag.model.SourceDescriptor;
import com.example.KbRag.retrieval.NoiseFilter;
import com.example.KbRag.retrieval.NoiseFilterResult;
import com.example.KbRag.retrieval.QueryExpander;
import com.example.KbRag.retrieval.QueryNormalizer;
import com.example.KbRag.retrieval.ScopeDecision;
import com.example.KbRag.retrieval.ScopeGuard;
import com.example.KbRag.retrieval.TitleReranker;
import com.example.KbRag.util.FrenchText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * RAG retrieval-only pipeline:
 * - Normalizes the question
 * - Expands it for lexical search and embeds it, in parallel
 * - Runs fused search (vector fallback handled by the gateway)
 * - Drops table-of-contents noise, boosts title matches
 * - Refuses out-of-scope questions
 * - Builds the numbered context the model sees
 *
 * This service does NOT generate answers. It is shared by the retrieval API
 * and the knowledge-base search tool the chat model calls.
 */
@Service
public class RagRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RagRetrievalService.class);

    public static final String NO_RESULTS_MESSAGE =
            "⚠️ HORS PÉRIMÈTRE: Aucune information pertinente trouvée dans la base de connaissances pour cette requête.";

    private static final String OUT_OF_SCOPE_TEMPLATE =
            "⚠️ PERTINENCE FAIBLE: Les résultats trouvés ont une pertinence maximale de %d%%, "
                    + "ce qui suggère que cette question est probablement HORS DU PÉRIMÈTRE de la base de connaissances.";

    static final String SEARCH_UNAVAILABLE_MESSAGE =
            "La recherche dans la base de connaissances est momentanément indisponible. Veuillez réessayer.";

    static final String TIMEOUT_MESSAGE =
            "La recherche a pris trop de temps. Veuillez réessayer.";

    static final String RATE_LIMITED_MESSAGE =
            "Le service d'embeddings est saturé. Veuillez réessayer dans quelques instants.";

    static final String EMBEDDING_FAILED_MESSAGE =
            "Impossible de calculer l'embedding de la question. Vérifiez la configuration du fournisseur.";

    /** Passages under this similarity are flagged as weak in the context. */
    private static final double LOW_CONFIDENCE = 0.6;

    private final QueryNormalizer normalizer;
    private final QueryExpander queryExpander;
    private final EmbeddingClient embeddingClient;
    private final SearchGateway searchGateway;
    private final NoiseFilter noiseFilter;
    private final TitleReranker titleReranker;
    private final ScopeGuard scopeGuard;
    private final SearchProperties properties;
    private final ResultCache<String, RetrievalOutcome> resultCache;

    public RagRetrievalService(
            QueryNormalizer normalizer,
            QueryExpander queryExpander,
            EmbeddingClient embeddingClient,
            SearchGateway searchGateway,
            NoiseFilter noiseFilter,
            TitleReranker titleReranker,
            ScopeGuard scopeGuard,
            SearchProperties properties,
            @Qualifier("queryResultCache") ResultCache<String, RetrievalOutcome> resultCache
    ) {
        this.normalizer = normalizer;
        this.queryExpander = queryExpander;
        this.embeddingClient = embeddingClient;
        this.searchGateway = searchGateway;
        this.noiseFilter = noiseFilter;
        this.titleReranker = titleReranker;
        this.scopeGuard = scopeGuard;
        this.properties = properties;
        this.resultCache = resultCache;
    }

    /**
     * Retrieval API entry point: resolves limit and threshold, runs the pipeline
     * and renders sources plus context.
     */
    public RagRetrievalResult retrieve(RagQueryRequest request) {
        Query query = toQuery(request);
        RetrievalOutcome outcome = retrieve(query);
        return toResult(outcome);
    }

    public Query toQuery(RagQueryRequest request) {
        int limit = request.resolveLimit(properties.getDefaultLimit(), properties.getMaxLimit());
        return Query.of(request.question(), limit, request.minScore());
    }

    /**
     * Runs the full pipeline for one query. Never throws for storage or model failures;
     * those come back as an ERROR outcome.
     */
    public RetrievalOutcome retrieve(Query query) {
        String normalized = normalizer.normalize(query.rawText());
        Query normalizedQuery = query.withNormalized(normalized);
        double threshold = query.resolveThreshold(properties.getSimilarityThreshold());

        String cacheKey = cacheKey(query.rawText(), query.limit(), threshold);
        Optional<RetrievalOutcome> cached = resultCache.get(cacheKey);
        if (cached.isPresent()) {
            log.info("Serving '{}' from result cache", normalized);
            // the cached outcome carries the Query of the request that filled it
            return cached.get().withQuery(normalizedQuery.withExpanded(cached.get().query().expandedText()));
        }

        log.info("Query normalized: '{}' -> '{}'", query.rawText(), normalized);

        Tuple2<String, float[]> prepared;
        try {
            prepared = prepare(normalized);
        } catch (RuntimeException e) {
            return preparationFailure(normalizedQuery, e);
        }

        Query expandedQuery = normalizedQuery.withExpanded(prepared.getT1());
        HybridSearchRequest searchRequest = new HybridSearchRequest(
                expandedQuery.lexicalText(),
                prepared.getT2(),
                query.limit(),
                threshold,
                properties.isExcludeBoilerplate(),
                properties.getRrfK(),
                properties.getMaxChunksPerDocument()
        );

        SearchOutcome search = searchGateway.search(searchRequest);
        if (!search.isAvailable()) {
            return RetrievalOutcome.error(expandedQuery, SEARCH_UNAVAILABLE_MESSAGE);
        }

        List<RetrievedPassage> passages = search.passages();

        boolean noiseFilterSkipped = false;
        if (properties.isExcludeBoilerplate()) {
            NoiseFilterResult filtered = noiseFilter.filter(passages);
            passages = filtered.passages();
            noiseFilterSkipped = filtered.skipped();
        }

        if (properties.getTitleRerank().isEnabled()) {
            passages = rerankSafely(query.rawText(), passages);
        }

        RetrievalOutcome outcome = decide(expandedQuery, passages, search, noiseFilterSkipped);
        resultCache.put(cacheKey, outcome);
        return outcome;
    }

    /**
     * Same pipeline on a worker thread, for callers composing Reactor streams.
     */
    public Mono<RetrievalOutcome> retrieveAsync(Query query) {
        return Mono.fromCallable(() -> retrieve(query))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Expansion and embedding are independent, so both run at once under the search timeout.
     * The embedding is computed on the normalized text; expansion only feeds lexical search.
     */
    private Tuple2<String, float[]> prepare(String normalized) {
        Mono<String> expansion = Mono.fromCallable(() -> queryExpander.expand(normalized))
                .subscribeOn(Schedulers.boundedElastic());
        Mono<float[]> embedding = Mono.fromCallable(() -> embeddingClient.embed(normalized))
                .subscribeOn(Schedulers.boundedElastic());

        Tuple2<String, float[]> prepared = Mono.zip(expansion, embedding)
                .timeout(properties.getTimeout())
                .block();
        if (prepared == null) {
            throw new IllegalStateException("Expansion or embedding returned nothing");
        }
        return prepared;
    }

    private RetrievalOutcome preparationFailure(Query query, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TimeoutException) {
            log.warn("Query preparation timed out after {}", properties.getTimeout());
            return RetrievalOutcome.error(query, TIMEOUT_MESSAGE);
        }
        if (cause instanceof EmbeddingException embeddingError) {
            log.error("Embedding failed for '{}' (rate limited: {})",
                    query.semanticText(), embeddingError.isRateLimited(), embeddingError);
            return RetrievalOutcome.error(query,
                    embeddingError.isRateLimited() ? RATE_LIMITED_MESSAGE : EMBEDDING_FAILED_MESSAGE);
        }
        log.error("Query preparation failed for '{}'", query.semanticText(), cause);
        return RetrievalOutcome.error(query, SEARCH_UNAVAILABLE_MESSAGE);
    }

    private List<RetrievedPassage> rerankSafely(String rawQuery, List<RetrievedPassage> passages) {
        try {
            return titleReranker.rerank(rawQuery, passages);
        } catch (RuntimeException e) {
            log.warn("Title rerank failed, keeping search order: {}", e.getMessage());
            return passages;
        }
    }

    private RetrievalOutcome decide(Query query, List<RetrievedPassage> passages, SearchOutcome search, boolean noiseFilterSkipped) {
        ScopeDecision decision = scopeGuard.evaluate(passages, properties.getOutOfScopeThreshold());

        switch (decision.verdict()) {
            case NO_RESULTS -> {
                log.warn("No passages found above similarity threshold");
                return RetrievalOutcome.noResults(query, search.path(), NO_RESULTS_MESSAGE);
            }
            case OUT_OF_SCOPE -> {
                return RetrievalOutcome.outOfScope(query, decision.maxSimilarity(), search.path(),
                        outOfScopeMessage(decision.maxSimilarity()));
            }
            default -> {
                RankedResultSet ranked = RankedResultSet.of(
                        decision.passages(), properties.getMaxChunksPerDocument(), query.limit());
                log.info("Retrieved {} passages via {} (max similarity {})",
                        ranked.size(), search.path(), String.format(Locale.US, "%.3f", ranked.maxSimilarity()));
                return RetrievalOutcome.passages(query, ranked, search.path(), noiseFilterSkipped);
            }
        }
    }

    public static String outOfScopeMessage(double maxSimilarity) {
        return String.format(Locale.ROOT, OUT_OF_SCOPE_TEMPLATE, (int) (maxSimilarity * 100));
    }

    /**
     * Numbered context for the model. Numbering matches the order of {@link #toSources}.
     *
     * Example:
     *   [1] Source: "Guide chantier" (Pertinence: 82%)
     *   content...
     *
     *   [2] Source: "Annexe B" (Pertinence: 55% - FAIBLE)
     *   content...
     */
    public String formatContext(RetrievalOutcome outcome) {
        if (!outcome.hasPassages()) {
            return outcome.message();
        }

        List<RetrievedPassage> passages = outcome.results().passages();
        List<String> parts = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            RetrievedPassage passage = passages.get(i);
            String marker = passage.similarity() < LOW_CONFIDENCE ? " - FAIBLE" : "";
            parts.add("[" + (i + 1) + "] Source: \"" + passage.documentTitle() + "\""
                    + " (Pertinence: " + (int) (passage.similarity() * 100) + "%" + marker + ")\n"
                    + passage.content());
        }

        return "Trouvé " + passages.size() + " résultats pertinents (triés par pertinence):\n\n"
                + String.join("\n\n", parts);
    }

    public List<SourceDescriptor> toSources(RetrievalOutcome outcome, boolean inlineContent) {
        List<RetrievedPassage> passages = outcome.results().passages();
        List<SourceDescriptor> sources = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            sources.add(SourceDescriptor.from(i + 1, passages.get(i), inlineContent));
        }
        return sources;
    }

    public RagRetrievalResult toResult(RetrievalOutcome outcome) {
        Query query = outcome.query();
        return new RagRetrievalResult(
                query.rawText(),
                query.normalizedText(),
                outcome.status(),
                toSources(outcome, true),
                formatContext(outcome)
        );
    }

    /**
     * Keyed on the raw question: re-ranking reads the raw text, so two questions that
     * normalize alike may still rank differently. Case and apostrophe style do not matter.
     */
    private static String cacheKey(String rawText, int limit, double threshold) {
        String key = FrenchText.normalizeApostrophes(rawText).strip().toLowerCase(Locale.FRENCH);
        return key + "|" + limit + "|" + threshold;
    }
}
