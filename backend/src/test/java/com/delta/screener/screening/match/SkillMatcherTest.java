package com.delta.screener.screening.match;

import com.delta.screener.screening.ResumeFixtures;
import com.delta.screener.screening.model.SkillMatchResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SkillMatcherTest {
    private final SkillMatcher matcher = ResumeFixtures.skillMatcher();

    @Test
    void matchesRequiredAndPreferredSkillsCaseInsensitively() {
        SkillMatchResult result = matcher.match(List.of("Python", "SQL"), List.of("Python", "Java"), List.of("SQL"));

        assertThat(result.matchedRequiredSkills()).containsExactly("Python");
        assertThat(result.missingRequiredSkills()).containsExactly("Java");
        assertThat(result.matchedPreferredSkills()).containsExactly("SQL");
        assertThat(result.requiredMatchRatio()).isEqualTo(0.5);
        assertThat(result.preferredMatchRatio()).isEqualTo(1.0);
        assertThat(result.skillMatchScore()).isEqualTo(65.0);
    }

    @Test
    void outputKeepsPostingCasingAndOrder() {
        SkillMatchResult result = matcher.match(
            List.of("docker", "KUBERNETES", "python"),
            List.of("Kubernetes", "Go", "Docker"),
            List.of()
        );

        assertThat(result.matchedRequiredSkills()).containsExactly("Kubernetes", "Docker");
        assertThat(result.missingRequiredSkills()).containsExactly("Go");
        assertThat(result.requiredMatchRatio()).isEqualTo(0.67);
        assertThat(result.skillMatchScore()).isEqualTo(46.67);
    }

    @Test
    void emptyResumeSkillsMissEverything() {
        SkillMatchResult result = matcher.match(List.of(), List.of("Python", "Java"), List.of("SQL"));

        assertThat(result.matchedRequiredSkills()).isEmpty();
        assertThat(result.missingRequiredSkills()).containsExactly("Python", "Java");
        assertThat(result.matchedPreferredSkills()).isEmpty();
        assertThat(result.skillMatchScore()).isZero();
        assertThat(result.similarityScore()).isZero();
    }

    @Test
    void emptyRequiredListContributesZeroRatio() {
        SkillMatchResult result = matcher.match(List.of("Python"), List.of(), List.of("Python"));

        assertThat(result.requiredMatchRatio()).isZero();
        assertThat(result.preferredMatchRatio()).isEqualTo(1.0);
        assertThat(result.skillMatchScore()).isEqualTo(30.0);
    }

    @Test
    void nullListsAreTreatedAsEmpty() {
        SkillMatchResult result = matcher.match(null, null, null);

        assertThat(result.skillMatchScore()).isZero();
        assertThat(result.missingRequiredSkills()).isEmpty();
    }

    @Test
    void similarityFallsBackToWordOverlapWhenVocabularyIsEmpty() {
        SkillMatchResult result = matcher.match(List.of("C"), List.of("C", "R"), List.of());

        // job words {c, r}, one of them present in the resume
        assertThat(result.similarityScore()).isEqualTo(0.5);
    }

    @Test
    void similarityDoesNotFeedSkillMatchScore() {
        SkillMatchResult exact = matcher.match(List.of("Python"), List.of("Python"), List.of());
        SkillMatchResult noisy = matcher.match(List.of("Python", "Cobol", "Fortran"), List.of("Python"), List.of());

        assertThat(exact.skillMatchScore()).isEqualTo(noisy.skillMatchScore()).isEqualTo(70.0);
        assertThat(exact.similarityScore()).isGreaterThan(noisy.similarityScore());
    }

    @Test
    void wordOverlapIsZeroForEmptyJobSide() {
        assertThat(SkillMatcher.wordOverlap("python", "   ")).isZero();
    }
}
