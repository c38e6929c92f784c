package com.example.KbRag.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankedResultSetTest {

    private static RetrievedPassage passage(String chunkId, String documentId, double similarity) {
        return RetrievedPassage.builder()
                .chunkId(chunkId)
                .documentId(documentId)
                .documentTitle(documentId)
                .similarity(similarity)
                .build();
    }

    @Test
    void sortsDescendingAndKeepsTieOrder() {
        RankedResultSet set = RankedResultSet.of(List.of(
                passage("a", "doc-1", 0.5),
                passage("b", "doc-2", 0.9),
                passage("c", "doc-3", 0.5)
        ), 5, 10);

        assertThat(set.passages()).extracting(RetrievedPassage::chunkId).containsExactly("b", "a", "c");
        assertThat(set.maxSimilarity()).isEqualTo(0.9);
    }

    @Test
    void capsPassagesPerDocumentAndOverall() {
        RankedResultSet set = RankedResultSet.of(List.of(
                passage("a1", "doc-a", 0.9),
                passage("a2", "doc-a", 0.8),
                passage("a3", "doc-a", 0.7),
                passage("b1", "doc-b", 0.6),
                passage("c1", "doc-c", 0.5)
        ), 2, 3);

        assertThat(set.passages()).extracting(RetrievedPassage::chunkId).containsExactly("a1", "a2", "b1");
    }

    @Test
    void passagesWithoutDocumentAreCappedIndividually() {
        RankedResultSet set = RankedResultSet.of(List.of(
                passage("x", null, 0.9),
                passage("y", null, 0.8)
        ), 1, 10);

        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    void citationIndexIsOneBased() {
        RankedResultSet set = new RankedResultSet(List.of(passage("a", "doc-a", 0.9), passage("b", "doc-b", 0.8)));

        assertThat(set.atCitationIndex(2).chunkId()).isEqualTo("b");
        assertThatThrownBy(() -> set.atCitationIndex(0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> set.atCitationIndex(3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void similarityIsClampedAndInvertedPageRangeRejected() {
        assertThat(passage("a", "doc", 1.4).similarity()).isEqualTo(1.0);
        assertThat(passage("a", "doc", -0.2).similarity()).isEqualTo(0.0);
        assertThatThrownBy(() -> new PassageMetadata(5, 3, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new PassageMetadata(3, 5, null, null).pageRangeLabel()).isEqualTo("p. 3-5");
    }
}
