package com.example.KbRag.model;

/**
 * A source the model actually referenced as [index] in its answer.
 */
public record Citation(int index, RetrievedPassage passage) {
}
