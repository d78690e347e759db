package com.delta.screener.screening.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class JobPostingRecordTest {

    @Test
    void skillListsDropBlanksNullsAndCaseInsensitiveDuplicates() {
        JobPostingRecord posting = new JobPostingRecord(
            1L,
            "Data Engineer",
            "Pipelines",
            Arrays.asList("Python", "python", " ", null, "SQL"),
            Arrays.asList(" Spark ", "SPARK", "sql"),
            3,
            "Bachelor's"
        );

        assertThat(posting.requiredSkills()).containsExactly("Python", "SQL");
        assertThat(posting.preferredSkills()).containsExactly("Spark", "sql");
    }

    @Test
    void missingListsBecomeEmpty() {
        JobPostingRecord posting = new JobPostingRecord(1L, "Data Engineer", null, null, null, null, null);

        assertThat(posting.requiredSkills()).isEmpty();
        assertThat(posting.preferredSkills()).isEmpty();
    }

    @Test
    void negativeExperienceAndBlankEducationMeanNoRequirement() {
        JobPostingRecord posting = new JobPostingRecord(1L, "Data Engineer", null, null, null, -2, "  ");

        assertThat(posting.minExperienceYears()).isNull();
        assertThat(posting.requiredEducation()).isNull();
    }
}
