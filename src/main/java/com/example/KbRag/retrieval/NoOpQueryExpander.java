package com.example.KbRag.retrieval;

/**
 * Used when expansion is switched off: no model call, input returned as is.
 */
public class NoOpQueryExpander implements QueryExpander {

    @Override
    public String expand(String query) {
        return query;
    }
}
