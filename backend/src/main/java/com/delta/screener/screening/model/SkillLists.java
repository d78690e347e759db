package com.delta.screener.screening.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class SkillLists {
    private SkillLists() {
    }

    /**
     * Trimmed, non-blank skills with case-insensitive duplicates removed; the first spelling wins.
     */
    static List<String> normalize(List<String> skills) {
        if (skills == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>();
        for (String skill : skills) {
            if (skill == null) {
                continue;
            }
            String trimmed = skill.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }
}
