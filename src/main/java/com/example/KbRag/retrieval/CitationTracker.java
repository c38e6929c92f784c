package com.example.KbRag.retrieval;

import com.example.KbRag.model.Citation;
import com.example.KbRag.model.RankedResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds which numbered sources the model cited in its final answer.
 */
@Component
public class CitationTracker {

    private static final Logger log = LoggerFactory.getLogger(CitationTracker.class);

    /**
     * [n] not glued to a word and not the text part of a Markdown link "[n](url)".
     * In "[[1]]" the inner "[1]" matches once.
     */
    private static final Pattern CITATION = Pattern.compile("(?<!\\w)\\[(\\d{1,6})\\](?!\\()");

    public SortedSet<Integer> extractCitedIndices(String answer) {
        if (answer == null || answer.isEmpty()) {
            return Collections.emptySortedSet();
        }
        SortedSet<Integer> indices = new TreeSet<>();
        Matcher matcher = CITATION.matcher(answer);
        while (matcher.find()) {
            indices.add(Integer.parseInt(matcher.group(1)));
        }
        if (!indices.isEmpty()) {
            log.info("Extracted cited source indices: {}", indices);
        }
        return indices;
    }

    /**
     * Keeps only indices inside [1, presentedCount].
     */
    public SortedSet<Integer> withinRange(Set<Integer> indices, int presentedCount) {
        SortedSet<Integer> valid = new TreeSet<>();
        for (Integer index : indices) {
            if (index >= 1 && index <= presentedCount) {
                valid.add(index);
            } else {
                log.debug("Ignoring citation [{}] outside [1, {}]", index, presentedCount);
            }
        }
        return valid;
    }

    public List<Citation> resolve(Set<Integer> indices, RankedResultSet presented) {
        List<Citation> citations = new ArrayList<>();
        for (Integer index : withinRange(indices, presented.size())) {
            citations.add(new Citation(index, presented.atCitationIndex(index)));
        }
        return citations;
    }
}
