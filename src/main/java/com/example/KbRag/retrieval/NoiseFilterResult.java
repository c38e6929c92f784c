package com.example.KbRag.retrieval;

import com.example.KbRag.model.RetrievedPassage;

import java.util.List;

/**
 * @param passages     passages left after filtering
 * @param skipped      true when every passage looked like boilerplate and the input was kept
 * @param removedCount number of passages dropped
 */
public record NoiseFilterResult(List<RetrievedPassage> passages, boolean skipped, int removedCount) {
}
