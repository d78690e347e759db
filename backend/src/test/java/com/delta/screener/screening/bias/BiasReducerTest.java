package com.delta.screener.screening.bias;

import com.delta.screener.screening.ResumeFixtures;
import com.delta.screener.screening.model.EducationLevel;
import com.delta.screener.screening.model.ParsedFields;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BiasReducerTest {
    private final BiasReducer reducer = ResumeFixtures.biasReducer();

    @Test
    void countsEachCategoryOnce() {
        String text = "John Smith, 35 years old, married. Married again later, married thrice.";

        assertThat(reducer.matchedCategories(text)).containsExactly("name", "age", "marital-status");
        assertThat(reducer.biasScore(text)).isEqualTo(0.375);
    }

    @Test
    void nameCheckNeedsCapitalizedWords() {
        String text = "john smith, 35 years old, married";

        assertThat(reducer.matchedCategories(text)).containsExactly("age", "marital-status");
        assertThat(reducer.biasScore(text)).isEqualTo(0.25);
    }

    @Test
    void photoMentionIsTheEighthCheck() {
        String text = "he lives in Berlin, is a british citizen, christian, single, photo attached, 29 y.o. Anna Berg";

        assertThat(reducer.matchedCategories(text)).hasSize(8);
        assertThat(reducer.biasScore(text)).isEqualTo(1.0);
    }

    @Test
    void cleanTextScoresZero() {
        assertThat(reducer.biasScore("backend engineer, kubernetes and postgres, seven services shipped")).isZero();
        assertThat(reducer.biasScore("")).isZero();
    }

    @Test
    void adjustedScoreAppliesAtMostTenPercentPenalty() {
        assertThat(reducer.adjustedScore(80.0, 0.375)).isEqualTo(77.0);
        assertThat(reducer.adjustedScore(80.0, 1.0)).isEqualTo(72.0);
        assertThat(reducer.adjustedScore(80.0, 0.0)).isEqualTo(80.0);
        assertThat(reducer.adjustedScore(0.0, 0.5)).isZero();
    }

    @Test
    void adjustedScoreIsStrictlyLowerWhenBiasPresent() {
        for (double overall : new double[] {12.5, 50.0, 64.5, 99.99}) {
            assertThat(reducer.adjustedScore(overall, 0.125)).isLessThan(overall);
        }
    }

    @Test
    void anonymizeRedactsHonorificNamesAndAges() {
        String original = "Dr. Jane Doe is 42 years old and leads the data team.";

        String anonymized = reducer.anonymize(original);

        assertThat(anonymized).isEqualTo("[Name] is [Age] and leads the data team.");
        assertThat(original).contains("Jane Doe");
    }

    @Test
    void filterIdentifiersClearsNameEmailAndPhone() {
        ParsedFields fields = new ParsedFields(
            "Jane Doe", "jane@example.com", "555-123-4567", List.of("Python"), List.of(), List.of(), "summary", 4,
            EducationLevel.MASTERS
        );

        ParsedFields filtered = reducer.filterIdentifiers(fields);

        assertThat(filtered.name()).isNull();
        assertThat(filtered.email()).isNull();
        assertThat(filtered.phone()).isNull();
        assertThat(filtered.skills()).containsExactly("Python");
        assertThat(fields.name()).isEqualTo("Jane Doe");
    }
}
