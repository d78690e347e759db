package com.delta.screener.screening.api;

import java.util.List;

public record SkillMatchRequest(
    List<String> resumeSkills,
    List<String> requiredSkills,
    List<String> preferredSkills
) {
}
