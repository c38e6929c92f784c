package com.example.KbRag.retrieval;

/**
 * Adds domain synonyms to a normalized query before lexical search.
 * Implementations never throw: on failure they return the query unchanged.
 */
public interface QueryExpander {

    String expand(String query);
}
