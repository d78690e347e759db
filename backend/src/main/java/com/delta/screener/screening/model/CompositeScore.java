package com.delta.screener.screening.model;

public record CompositeScore(
    double overallScore,
    double experienceScore,
    double educationScore,
    SkillMatchResult skillMatch
) {
}
