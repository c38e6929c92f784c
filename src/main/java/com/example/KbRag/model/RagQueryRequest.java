package com.example.KbRag.model;

public record RagQueryRequest(
        String question,
        Integer limit,
        Double minScore
) {
    public int resolveLimit(int defaultValue, int maxValue) {
        int value = limit == null || limit <= 0 ? defaultValue : limit;
        return Math.min(value, maxValue);
    }
}
