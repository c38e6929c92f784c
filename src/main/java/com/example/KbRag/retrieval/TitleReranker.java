package com.example.KbRag.retrieval;

import com.example.KbRag.config.SearchProperties;
import com.example.KbRag.model.RetrievedPassage;
import com.example.KbRag.util.FrenchText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Boosts passages whose parent document title matches keywords of the question.
 *
 * Classifier keywords ("type D", "classe II") weigh two thirds of the maximum boost per match,
 * other content words one fifth; the total never exceeds the configured boost and
 * similarity stays at or below 1.0. The re-sort is stable.
 */
@Component
public class TitleReranker {

    private static final Logger log = LoggerFactory.getLogger(TitleReranker.class);

    /** Single letter, number, roman numeral, or letter plus digits; never an elided "d'". */
    private static final String SUFFIX = "([a-z]|\\d{1,3}[a-z]?|[ivx]{1,5}|[a-z]\\d{1,2})\\b(?!')";

    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    private final Set<String> classifiers;
    private final Pattern classifierPattern;
    private final double maxBoost;

    public TitleReranker(SearchProperties properties) {
        SearchProperties.TitleRerank settings = properties.getTitleRerank();
        this.maxBoost = settings.getBoost();
        this.classifiers = settings.getClassifiers().stream()
                .map(FrenchText::fold)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        this.classifierPattern = classifiers.isEmpty() ? null : Pattern.compile(
                "\\b(" + classifiers.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")s?\\s+" + SUFFIX);
    }

    public List<RetrievedPassage> rerank(String rawQuery, List<RetrievedPassage> passages) {
        if (passages == null || passages.isEmpty()) {
            return List.of();
        }
        QueryKeywords keywords = extractKeywords(rawQuery);
        if (keywords.isEmpty()) {
            return passages;
        }

        List<RetrievedPassage> boosted = new ArrayList<>(passages.size());
        int boostedCount = 0;
        for (RetrievedPassage passage : passages) {
            double boost = boostFor(passage.documentTitle(), keywords);
            if (boost > 0) {
                boostedCount++;
                boosted.add(passage.withSimilarity(passage.similarity() + boost));
            } else {
                boosted.add(passage);
            }
        }

        boosted.sort(Comparator.comparingDouble(RetrievedPassage::similarity).reversed());

        if (boostedCount > 0) {
            log.info("Title rerank boosted {}/{} passages for keywords {} {}",
                    boostedCount, passages.size(), keywords.classifierKeywords(), keywords.contentKeywords());
        }
        return boosted;
    }

    public QueryKeywords extractKeywords(String query) {
        String folded = FrenchText.fold(FrenchText.normalizeApostrophes(query == null ? "" : query));

        Set<String> classifierKeywords = new LinkedHashSet<>();
        Set<String> consumed = new LinkedHashSet<>();
        if (classifierPattern != null) {
            Matcher matcher = classifierPattern.matcher(folded);
            while (matcher.find()) {
                classifierKeywords.add(matcher.group(1) + " " + matcher.group(2).toUpperCase(Locale.ROOT));
                consumed.add(matcher.group(2));
            }
        }

        Set<String> contentKeywords = new LinkedHashSet<>();
        Matcher words = WORD.matcher(folded);
        while (words.find()) {
            String word = words.group();
            if (word.length() > 3
                    && !FrenchText.KEYWORD_STOPWORDS.contains(word)
                    && !FrenchText.STOPWORDS.contains(word)
                    && !isClassifierStem(word)
                    && !consumed.contains(word)) {
                contentKeywords.add(word);
            }
        }
        return new QueryKeywords(List.copyOf(classifierKeywords), List.copyOf(contentKeywords));
    }

    public double boostFor(String title, QueryKeywords keywords) {
        if (title == null || title.isBlank() || keywords.isEmpty()) {
            return 0.0;
        }
        String foldedTitle = FrenchText.fold(FrenchText.normalizeApostrophes(title));

        double boost = 0.0;
        for (String keyword : keywords.classifierKeywords()) {
            if (classifierMatches(foldedTitle, keyword)) {
                boost += maxBoost * 2.0 / 3.0;
            }
        }
        for (String keyword : keywords.contentKeywords()) {
            if (wordMatches(foldedTitle, keyword)) {
                boost += maxBoost / 5.0;
            }
        }
        return Math.min(maxBoost, boost);
    }

    private boolean isClassifierStem(String word) {
        return classifiers.contains(word) || (word.endsWith("s") && classifiers.contains(word.substring(0, word.length() - 1)));
    }

    private static boolean classifierMatches(String foldedTitle, String keyword) {
        int space = keyword.indexOf(' ');
        String stem = keyword.substring(0, space);
        String suffix = keyword.substring(space + 1).toLowerCase(Locale.ROOT);
        Pattern pattern = Pattern.compile(
                "\\b" + Pattern.quote(stem) + "s?\\s+" + Pattern.quote(suffix) + "\\b(?!')");
        return pattern.matcher(foldedTitle).find();
    }

    private static boolean wordMatches(String foldedTitle, String keyword) {
        // "chantiers" in the question still matches "chantier" in the title
        String root = keyword.length() > 4 && (keyword.endsWith("s") || keyword.endsWith("x"))
                ? keyword.substring(0, keyword.length() - 1)
                : keyword;
        return Pattern.compile("\\b" + Pattern.quote(root)).matcher(foldedTitle).find();
    }

    public record QueryKeywords(List<String> classifierKeywords, List<String> contentKeywords) {
        public boolean isEmpty() {
            return classifierKeywords.isEmpty() && contentKeywords.isEmpty();
        }
    }
}
