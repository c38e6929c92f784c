package com.example.KbRag.retrieval;

import com.example.KbRag.util.FrenchText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips interrogative scaffolding from a French question while keeping the words
 * that carry its meaning.
 *
 * "C'est quoi un chantier de type D ?" becomes "chantier de type d".
 * Pure and deterministic; an already normalized query comes back unchanged.
 */
@Component
public class QueryNormalizer {

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s?!.;:,…]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Elided article glued to the next word: "l'occupation". */
    private static final Pattern ELIDED_ARTICLE = Pattern.compile("^l'(.+)$");

    private static final List<Pattern> QUESTION_PATTERNS = FrenchText.QUESTION_PATTERNS.stream()
            .map(QueryNormalizer::wordBounded)
            .toList();

    public String normalize(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return rawQuery;
        }

        String text = FrenchText.normalizeApostrophes(rawQuery).toLowerCase(Locale.FRENCH).trim();
        text = TRAILING_PUNCTUATION.matcher(text).replaceAll("");

        for (Pattern pattern : QUESTION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                text = matcher.replaceAll(" ").trim();
                text = stripDanglingLeaders(text);
            }
        }

        List<String> kept = new ArrayList<>();
        for (String token : WHITESPACE.split(text)) {
            if (token.isEmpty()) {
                continue;
            }
            Matcher elided = ELIDED_ARTICLE.matcher(token);
            if (elided.matches()) {
                token = elided.group(1);
            }
            if (FrenchText.SEMANTIC_MARKERS.contains(token) || !FrenchText.STOPWORDS.contains(token)) {
                kept.add(token);
            }
        }

        String normalized = String.join(" ", kept).trim();
        return normalized.isEmpty() ? rawQuery : normalized;
    }

    private static String stripDanglingLeaders(String text) {
        List<String> tokens = new ArrayList<>(Arrays.asList(WHITESPACE.split(text)));
        while (!tokens.isEmpty() && (tokens.get(0).isEmpty() || FrenchText.DANGLING_LEADERS.contains(tokens.get(0)))) {
            tokens.remove(0);
        }
        return String.join(" ", tokens);
    }

    private static Pattern wordBounded(String phrase) {
        // \b does not treat accented letters or apostrophes as word characters, so use explicit lookarounds
        String lookahead = phrase.endsWith("'") ? "" : "(?![\\p{L}\\p{N}])";
        return Pattern.compile("(?<![\\p{L}\\p{N}'])" + Pattern.quote(phrase) + lookahead);
    }
}
