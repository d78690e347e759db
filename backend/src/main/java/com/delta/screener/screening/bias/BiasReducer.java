package com.delta.screener.screening.bias;

import com.delta.screener.screening.model.ParsedFields;
import com.delta.screener.screening.util.ScoreMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class BiasReducer {
    private static final Pattern HONORIFIC_NAME =
        Pattern.compile("\\b(?:Mr\\.?|Mrs\\.?|Ms\\.?|Dr\\.?)\\s+[A-Z][a-z]+\\s+[A-Z][a-z]+\\b");
    private static final Pattern AGE =
        Pattern.compile("\\b\\d{1,2}\\s*(?:years?\\s*old|y\\.?o\\.?)\\b", Pattern.CASE_INSENSITIVE);
    static final String NAME_PLACEHOLDER = "[Name]";
    static final String AGE_PLACEHOLDER = "[Age]";
    static final double PENALTY_WEIGHT = 0.1;

    private final BiasPatternTable patterns;

    public BiasReducer(BiasPatternTable patterns) {
        this.patterns = patterns;
    }

    /**
     * Share of checks with at least one hit, in [0, 1] with three decimals.
     */
    public double biasScore(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        return ScoreMath.round(ScoreMath.ratio(matchedCategories(text).size(), patterns.totalChecks()), 3);
    }

    public List<String> matchedCategories(String text) {
        List<String> hits = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return hits;
        }
        for (Map.Entry<String, Pattern> category : patterns.categories().entrySet()) {
            if (category.getValue().matcher(text).find()) {
                hits.add(category.getKey());
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (patterns.photoTerms().stream().anyMatch(lower::contains)) {
            hits.add("photo");
        }
        return hits;
    }

    public double adjustedScore(double overallScore, double biasScore) {
        double bias = ScoreMath.clamp(biasScore, 0.0, 1.0);
        double adjusted = overallScore * (1 - bias * PENALTY_WEIGHT);
        return ScoreMath.round(Math.max(0.0, adjusted), 2);
    }

    /**
     * Redacts honorific-prefixed full names and age phrases. Returns a new string.
     */
    public String anonymize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String anonymized = HONORIFIC_NAME.matcher(text).replaceAll(NAME_PLACEHOLDER);
        return AGE.matcher(anonymized).replaceAll(AGE_PLACEHOLDER);
    }

    public ParsedFields filterIdentifiers(ParsedFields fields) {
        return fields == null ? null : fields.withoutIdentifiers();
    }
}
