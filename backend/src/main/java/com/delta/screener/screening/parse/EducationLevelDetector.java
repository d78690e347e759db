package com.delta.screener.screening.parse;

import com.delta.screener.screening.model.EducationLevel;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Highest education level mentioned anywhere in the text. Keywords and abbreviations are matched
 * as whole words against the lowercased text, dots optional ("ms", "M.S.", "b.e" all count).
 */
public class EducationLevelDetector {

    private record LevelPattern(EducationLevel level, Pattern pattern) {
    }

    private static final List<LevelPattern> PRIORITY = List.of(
        new LevelPattern(EducationLevel.PHD, Pattern.compile("\\b(?:phd|ph\\.d\\.?|doctorate|d\\.?phil\\.?)\\b")),
        new LevelPattern(EducationLevel.MASTERS, Pattern.compile("\\b(?:masters?|m\\.?s\\.?|m\\.?a\\.?|mba)\\b")),
        new LevelPattern(
            EducationLevel.BACHELORS,
            Pattern.compile("\\b(?:bachelors?|b\\.?s\\.?|b\\.?a\\.?|b\\.?e\\.?)\\b")
        ),
        new LevelPattern(EducationLevel.DIPLOMA, Pattern.compile("\\b(?:diploma|associate)\\b"))
    );

    public EducationLevel detect(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (LevelPattern candidate : PRIORITY) {
            if (candidate.pattern().matcher(lower).find()) {
                return candidate.level();
            }
        }
        return null;
    }
}
