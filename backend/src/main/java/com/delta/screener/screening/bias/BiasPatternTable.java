package com.delta.screener.screening.bias;

import com.delta.screener.config.ScreeningProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled category name to pattern table, plus the photo-mention terms counted as one extra check.
 */
public final class BiasPatternTable {
    private final Map<String, Pattern> categories;
    private final List<String> photoTerms;

    public BiasPatternTable(Map<String, Pattern> categories, List<String> photoTerms) {
        this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        List<String> terms = new ArrayList<>();
        for (String term : photoTerms) {
            if (term != null && !term.isBlank()) {
                terms.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.photoTerms = List.copyOf(terms);
    }

    public static BiasPatternTable fromProperties(ScreeningProperties.Bias bias) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, ScreeningProperties.Category> entry : bias.getCategories().entrySet()) {
            ScreeningProperties.Category category = entry.getValue();
            if (category == null || category.getPattern() == null || category.getPattern().isBlank()) {
                throw new IllegalStateException("Bias category '" + entry.getKey() + "' has no pattern");
            }
            int flags = category.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE;
            try {
                compiled.put(entry.getKey(), Pattern.compile(category.getPattern(), flags));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Invalid pattern for bias category '" + entry.getKey() + "'", e);
            }
        }
        return new BiasPatternTable(compiled, bias.getPhotoTerms());
    }

    public Map<String, Pattern> categories() {
        return categories;
    }

    public List<String> photoTerms() {
        return photoTerms;
    }

    /**
     * Number of checks a text is scored against: every category, plus one for photo mentions.
     */
    public int totalChecks() {
        return categories.size() + 1;
    }
}
