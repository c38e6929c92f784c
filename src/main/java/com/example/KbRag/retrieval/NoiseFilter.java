package com.example.KbRag.retrieval;

import com.example.KbRag.config.SearchProperties;
import com.example.KbRag.model.RetrievedPassage;
import com.example.KbRag.util.FrenchText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Client-side table-of-contents detector for chunks the storage label missed.
 *
 * A passage is boilerplate when any of these holds, checked in order:
 * its storage label says so; its first line is a known TOC header;
 * more than {@code noiseLineRatio} of its lines end in a page number.
 */
@Component
public class NoiseFilter {

    private static final Logger log = LoggerFactory.getLogger(NoiseFilter.class);

    private static final List<String> TOC_HEADERS = List.of(
            "table des matieres", "table of contents", "sommaire", "contents");

    private static final Pattern HEADER_DECORATION = Pattern.compile("^[#*_=\\-|\\s]+|[#*_=\\-|:\\s]+$");

    /** "2.1 Champ d'application ........ 14" or "Annexe B 27". */
    private static final Pattern PAGE_NUMBER_LINE =
            Pattern.compile("^.*\\p{L}.*?(?:\\.{2,}|…+|\\s)\\s*\\d{1,4}\\s*$");

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private static final int MIN_LINES_FOR_RATIO = 3;

    private final double lineRatio;

    public NoiseFilter(SearchProperties properties) {
        this.lineRatio = properties.getNoiseLineRatio();
    }

    public NoiseFilterResult filter(List<RetrievedPassage> passages) {
        if (passages == null || passages.isEmpty()) {
            return new NoiseFilterResult(List.of(), false, 0);
        }

        List<RetrievedPassage> kept = passages.stream()
                .filter(p -> !isBoilerplate(p))
                .toList();

        if (kept.isEmpty()) {
            log.warn("All {} passages look like tables of contents, keeping them unfiltered", passages.size());
            return new NoiseFilterResult(List.copyOf(passages), true, 0);
        }

        int removed = passages.size() - kept.size();
        if (removed > 0) {
            log.info("Noise filter removed {} table-of-contents passage(s)", removed);
        }
        return new NoiseFilterResult(kept, false, removed);
    }

    public boolean isBoilerplate(RetrievedPassage passage) {
        if (passage.boilerplate()) {
            return true;
        }
        String[] lines = nonBlankLines(passage.content());
        return lines.length > 0 && (hasTocHeader(lines[0]) || pageNumberRatio(lines) > lineRatio);
    }

    private static boolean hasTocHeader(String firstLine) {
        String header = HEADER_DECORATION.matcher(FrenchText.fold(firstLine)).replaceAll("");
        for (String candidate : TOC_HEADERS) {
            if (header.equals(candidate)
                    || header.startsWith(candidate + " ")
                    || header.startsWith(candidate + ":")) {
                return true;
            }
        }
        return false;
    }

    private static double pageNumberRatio(String[] lines) {
        if (lines.length < MIN_LINES_FOR_RATIO) {
            return 0.0;
        }
        long matching = 0;
        for (String line : lines) {
            if (PAGE_NUMBER_LINE.matcher(line).matches()) {
                matching++;
            }
        }
        return (double) matching / lines.length;
    }

    private static String[] nonBlankLines(String content) {
        if (content == null || content.isBlank()) {
            return new String[0];
        }
        return LINE_BREAK.splitAsStream(content)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toArray(String[]::new);
    }
}
