package com.delta.screener.screening.model;

import java.util.List;

public record ParsedFields(
    String name,
    String email,
    String phone,
    List<String> skills,
    List<ExperienceEntry> experience,
    List<EducationEntry> education,
    String summary,
    Integer experienceYears,
    EducationLevel educationLevel
) {
    public ParsedFields {
        skills = skills == null ? List.of() : List.copyOf(skills);
        experience = experience == null ? List.of() : List.copyOf(experience);
        education = education == null ? List.of() : List.copyOf(education);
    }

    public ParsedFields withoutIdentifiers() {
        return new ParsedFields(null, null, null, skills, experience, education, summary, experienceYears, educationLevel);
    }
}
