package com.delta.screener.screening.model;

import java.util.ArrayList;
import java.util.List;

public record ResumeRecord(
    Long id,
    String originalText,
    ParsedFields parsedFields,
    List<String> skills,
    Integer experienceYears,
    EducationLevel educationLevel
) {
    public ResumeRecord {
        skills = SkillLists.normalize(skills);
        if (experienceYears != null && experienceYears < 0) {
            experienceYears = null;
        }
    }

    public static ResumeRecord fromParsed(Long id, String originalText, ParsedFields parsed) {
        return new ResumeRecord(
            id,
            originalText,
            parsed,
            new ArrayList<>(parsed.skills()),
            parsed.experienceYears(),
            parsed.educationLevel()
        );
    }

    public String candidateName() {
        return parsedFields == null ? null : parsedFields.name();
    }
}
