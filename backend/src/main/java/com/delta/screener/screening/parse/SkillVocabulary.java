package com.delta.screener.screening.parse;

import com.delta.screener.screening.util.TextUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Known technical-skill keywords, matched as case-insensitive substrings.
 */
public final class SkillVocabulary {
    private final List<String> keywords;

    public SkillVocabulary(List<String> keywords) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.keywords = List.copyOf(normalized);
    }

    public List<String> keywords() {
        return keywords;
    }

    public int size() {
        return keywords.size();
    }

    /**
     * Keywords occurring anywhere in {@code text}, title-cased, in vocabulary order.
     */
    public List<String> findIn(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                found.add(TextUtils.titleCase(keyword));
            }
        }
        return found;
    }

    public boolean mentionedIn(String phrase) {
        if (phrase == null || phrase.isEmpty()) {
            return false;
        }
        String lower = phrase.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
