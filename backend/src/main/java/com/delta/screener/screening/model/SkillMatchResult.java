package com.delta.screener.screening.model;

import java.util.List;

public record SkillMatchResult(
    List<String> matchedRequiredSkills,
    List<String> missingRequiredSkills,
    List<String> matchedPreferredSkills,
    double requiredMatchRatio,
    double preferredMatchRatio,
    double skillMatchScore,
    double similarityScore
) {
    public SkillMatchResult {
        matchedRequiredSkills = List.copyOf(matchedRequiredSkills);
        missingRequiredSkills = List.copyOf(missingRequiredSkills);
        matchedPreferredSkills = List.copyOf(matchedPreferredSkills);
    }
}
