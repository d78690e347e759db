package com.delta.screener.screening.model;

import java.util.List;

public record JobPostingRecord(
    Long id,
    String title,
    String description,
    List<String> requiredSkills,
    List<String> preferredSkills,
    Integer minExperienceYears,
    String requiredEducation
) {
    public JobPostingRecord {
        requiredSkills = SkillLists.normalize(requiredSkills);
        preferredSkills = SkillLists.normalize(preferredSkills);
        if (minExperienceYears != null && minExperienceYears < 0) {
            minExperienceYears = null;
        }
        if (requiredEducation != null && requiredEducation.isBlank()) {
            requiredEducation = null;
        }
    }
}
