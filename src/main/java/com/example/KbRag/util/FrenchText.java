package com.example.KbRag.util;

import java.text.Normalizer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * French word lists and text helpers shared by query normalization and title re-ranking.
 */
public final class FrenchText {

    private FrenchText() {
    }

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    /**
     * Generic filler dropped from normalized queries.
     * Prepositions such as "de", "du", "des" are deliberately absent.
     */
    public static final Set<String> STOPWORDS = Set.of(
            "le", "la", "les", "un", "une",
            "je", "tu", "il", "elle", "nous", "vous", "ils", "elles",
            "est", "sont", "peut", "faut"
    );

    /**
     * Tokens that carry scope or relationship meaning and are never dropped.
     */
    public static final Set<String> SEMANTIC_MARKERS = Set.of(
            "de", "du", "des", "d",
            "tous", "toutes", "tout", "toute",
            "plus", "moins", "maximum", "minimum",
            "ne", "pas", "sans"
    );

    /**
     * Interrogative scaffolding, longest first so that "comment est-ce que"
     * is removed before "comment".
     */
    public static final List<String> QUESTION_PATTERNS = List.of(
            "qu'est-ce que c'est", "qu est ce que c est",
            "qu'est-ce que", "qu est ce que",
            "c'est quoi", "c est quoi",
            "quelle est", "quel est", "quelles sont", "quels sont",
            "quelles", "quelle", "quels", "quel",
            "comment est-ce que", "comment est ce que", "comment",
            "quand est-ce que", "quand est ce que", "quand",
            "où est-ce que", "où est ce que", "où",
            "combien de", "combien d'", "combien",
            "pourquoi est-ce que", "pourquoi est ce que", "pourquoi",
            "est-ce que", "est ce que"
    ).stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    /**
     * Words left hanging at the start of a question once its interrogative part is gone,
     * e.g. "la" in "quelle est la hauteur".
     */
    public static final Set<String> DANGLING_LEADERS = Set.of(
            "le", "la", "les", "l'", "un", "une", "de", "du", "des", "d'", "que", "qu'", "à", "a", "en"
    );

    /**
     * Accent-free words ignored when extracting title keywords from a question.
     */
    public static final Set<String> KEYWORD_STOPWORDS = Set.of(
            "quoi", "quel", "quelle", "quels", "quelles", "comment", "pourquoi", "quand", "combien",
            "cest", "estce", "quest", "sont", "etre", "avoir", "faire", "peut", "peuvent", "faut",
            "dans", "pour", "avec", "sans", "sous", "entre", "vers", "chez", "depuis", "pendant",
            "leur", "leurs", "cette", "ces", "celui", "celle", "ceux", "mon", "mes", "notre", "votre",
            "tous", "toutes", "tout", "toute", "plus", "moins", "tres", "aussi", "alors", "donc",
            "what", "which", "does", "with", "from", "that", "this", "there", "about"
    );

    /**
     * Lower-cases (French rules) and removes diacritics: "Matières" becomes "matieres".
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.FRENCH);
    }

    /**
     * Replaces typographic apostrophes with the ASCII one.
     */
    public static String normalizeApostrophes(String text) {
        return text.replace('’', '\'').replace('‘', '\'').replace('`', '\'');
    }
}
