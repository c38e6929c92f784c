package com.example.KbRag.retrieval;

import com.example.KbRag.model.RetrievedPassage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether the knowledge base can answer at all.
 * Must run after title re-ranking, since boosts can lift a borderline passage over the threshold.
 */
@Component
public class ScopeGuard {

    private static final Logger log = LoggerFactory.getLogger(ScopeGuard.class);

    public ScopeDecision evaluate(List<RetrievedPassage> passages, double outOfScopeThreshold) {
        if (passages == null || passages.isEmpty()) {
            return new ScopeDecision(ScopeDecision.Verdict.NO_RESULTS, 0.0, List.of());
        }

        double max = passages.stream()
                .mapToDouble(RetrievedPassage::similarity)
                .max()
                .orElse(0.0);

        if (max < outOfScopeThreshold) {
            log.warn("Low relevance results - max similarity: {}", String.format("%.2f", max));
            return new ScopeDecision(ScopeDecision.Verdict.OUT_OF_SCOPE, max, List.of());
        }
        return new ScopeDecision(ScopeDecision.Verdict.IN_SCOPE, max, passages);
    }
}
