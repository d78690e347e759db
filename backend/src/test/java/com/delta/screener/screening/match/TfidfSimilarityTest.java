package com.delta.screener.screening.match;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TfidfSimilarityTest {
    private final TfidfSimilarity similarity = new TfidfSimilarity();

    @Test
    void identicalDocumentsAreFullySimilar() {
        assertThat(similarity.similarity("Python Docker", "python docker").getAsDouble()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void disjointDocumentsScoreZero() {
        assertThat(similarity.similarity("Python Docker", "Java Kubernetes").getAsDouble()).isEqualTo(0.0);
    }

    @Test
    void sharedTermsAreWeightedBySmoothedIdf() {
        // python: df=2, idf=1; java and "python java": df=1, idf=ln(3/2)+1
        assertThat(similarity.similarity("python", "python java").getAsDouble()).isCloseTo(0.449436, within(1e-6));
    }

    @Test
    void singleCharacterTokensLeaveNoVocabulary() {
        OptionalDouble result = similarity.similarity("C R", "C");

        assertThat(result).isEmpty();
    }

    @Test
    void termCountsIncludeBigrams() {
        Map<String, Integer> counts = TfidfSimilarity.termCounts("Machine Learning, machine vision");

        assertThat(counts)
            .containsEntry("machine", 2)
            .containsEntry("machine learning", 1)
            .containsEntry("learning machine", 1)
            .containsEntry("machine vision", 1);
    }

    @Test
    void maxFeaturesKeepsMostFrequentTerms() {
        TfidfSimilarity narrow = new TfidfSimilarity(1);

        assertThat(narrow.similarity("java java python", "java").getAsDouble()).isCloseTo(1.0, within(1e-9));
    }
}
