package com.example.KbRag.model;

/**
 * Which storage operation produced a result list.
 */
public enum SearchPath {
    FUSED,
    VECTOR_FALLBACK,
    UNAVAILABLE
}
