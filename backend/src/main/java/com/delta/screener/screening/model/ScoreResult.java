package com.delta.screener.screening.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreResult(
    double overallScore,
    double skillMatchScore,
    double experienceScore,
    double educationScore,
    List<String> matchedSkills,
    List<String> missingSkills,
    List<String> preferredSkillsMatched,
    double biasScore,
    double anonymizedScore,
    Integer rank,
    SkillMatchResult skillMatchDetails
) {
    public static ScoreResult of(CompositeScore composite, double biasScore, double anonymizedScore) {
        SkillMatchResult match = composite.skillMatch();
        return new ScoreResult(
            composite.overallScore(),
            match.skillMatchScore(),
            composite.experienceScore(),
            composite.educationScore(),
            match.matchedRequiredSkills(),
            match.missingRequiredSkills(),
            match.matchedPreferredSkills(),
            biasScore,
            anonymizedScore,
            null,
            match
        );
    }

    public static ScoreResult empty() {
        SkillMatchResult match = new SkillMatchResult(List.of(), List.of(), List.of(), 0.0, 0.0, 0.0, 0.0);
        return new ScoreResult(0.0, 0.0, 0.0, 0.0, List.of(), List.of(), List.of(), 0.0, 0.0, null, match);
    }

    public ScoreResult withRank(int newRank) {
        return new ScoreResult(
            overallScore,
            skillMatchScore,
            experienceScore,
            educationScore,
            matchedSkills,
            missingSkills,
            preferredSkillsMatched,
            biasScore,
            anonymizedScore,
            newRank,
            skillMatchDetails
        );
    }
}
