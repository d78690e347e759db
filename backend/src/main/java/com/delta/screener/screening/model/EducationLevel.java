package com.delta.screener.screening.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EducationLevel {
    DIPLOMA("Diploma", 1),
    BACHELORS("Bachelor's", 2),
    MASTERS("Master's", 3),
    PHD("PhD", 4);

    private final String label;
    private final int rank;

    EducationLevel(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    /**
     * Resolves a display label ("Master's") or enum name ("MASTERS"); returns null for anything else.
     */
    @JsonCreator
    public static EducationLevel fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        for (EducationLevel level : values()) {
            if (level.label.equalsIgnoreCase(candidate) || level.name().equalsIgnoreCase(candidate)) {
                return level;
            }
        }
        return null;
    }

    /**
     * Ordinal used for requirement comparisons; unrecognized or missing labels rank 0.
     */
    public static int rankOf(String label) {
        EducationLevel level = fromLabel(label);
        return level == null ? 0 : level.rank;
    }
}
