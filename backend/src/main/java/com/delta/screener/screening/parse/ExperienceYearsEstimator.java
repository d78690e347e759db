package com.delta.screener.screening.parse;

import java.time.Clock;
import java.time.Year;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives total years of experience, preferring explicit "N years of experience" statements over
 * summed date ranges.
 */
public class ExperienceYearsEstimator {
    private static final Pattern STATED_YEARS =
        Pattern.compile("(\\d+)\\+?\\s*(?:years?|yrs?)\\s*(?:of\\s*)?(?:experience|exp)");
    private static final Pattern DATE_RANGE =
        Pattern.compile("(\\d{4})\\s*[-–—]\\s*(\\d{4}|present|current)", Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private final Integer referenceYear;

    public ExperienceYearsEstimator(Clock clock, Integer referenceYear) {
        this.clock = clock;
        this.referenceYear = referenceYear;
    }

    public Integer estimate(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Integer stated = maxStatedYears(text.toLowerCase(Locale.ROOT));
        if (stated != null) {
            return stated;
        }
        return summedDateRanges(text);
    }

    int currentYear() {
        return referenceYear != null ? referenceYear : Year.now(clock).getValue();
    }

    private Integer maxStatedYears(String lower) {
        Matcher matcher = STATED_YEARS.matcher(lower);
        Integer max = null;
        while (matcher.find()) {
            Integer years = parseInt(matcher.group(1));
            if (years != null && (max == null || years > max)) {
                max = years;
            }
        }
        return max;
    }

    private Integer summedDateRanges(String text) {
        Matcher matcher = DATE_RANGE.matcher(text);
        boolean found = false;
        int total = 0;
        int now = currentYear();
        while (matcher.find()) {
            found = true;
            Integer start = parseInt(matcher.group(1));
            String endToken = matcher.group(2).toLowerCase(Locale.ROOT);
            Integer end = "present".equals(endToken) || "current".equals(endToken) ? Integer.valueOf(now) : parseInt(endToken);
            if (start != null && end != null) {
                total += end - start;
            }
        }
        if (!found || total <= 0) {
            return null;
        }
        return total;
    }

    private static Integer parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
