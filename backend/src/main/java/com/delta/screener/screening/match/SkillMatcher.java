package com.delta.screener.screening.match;

import com.delta.screener.screening.model.SkillMatchResult;
import com.delta.screener.screening.util.ScoreMath;
import com.delta.screener.screening.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

public class SkillMatcher {
    private static final Logger log = LoggerFactory.getLogger(SkillMatcher.class);

    static final double REQUIRED_WEIGHT = 0.7;
    static final double PREFERRED_WEIGHT = 0.3;

    private final TfidfSimilarity similarity;

    public SkillMatcher(TfidfSimilarity similarity) {
        this.similarity = similarity;
    }

    public SkillMatchResult match(List<String> resumeSkills, List<String> requiredSkills, List<String> preferredSkills) {
        List<String> resume = nonNull(resumeSkills);
        List<String> required = nonNull(requiredSkills);
        List<String> preferred = nonNull(preferredSkills);

        Set<String> resumeLower = new HashSet<>(TextUtils.lowercase(resume));

        List<String> matchedRequired = new ArrayList<>();
        List<String> missingRequired = new ArrayList<>();
        for (String skill : required) {
            if (resumeLower.contains(skill.toLowerCase(Locale.ROOT))) {
                matchedRequired.add(skill);
            } else {
                missingRequired.add(skill);
            }
        }
        List<String> matchedPreferred = new ArrayList<>();
        for (String skill : preferred) {
            if (resumeLower.contains(skill.toLowerCase(Locale.ROOT))) {
                matchedPreferred.add(skill);
            }
        }

        double requiredRatio = ScoreMath.ratio(matchedRequired.size(), required.size());
        double preferredRatio = ScoreMath.ratio(matchedPreferred.size(), preferred.size());
        double skillMatchScore = (requiredRatio * REQUIRED_WEIGHT + preferredRatio * PREFERRED_WEIGHT) * 100;

        List<String> jobSkills = new ArrayList<>(required);
        jobSkills.addAll(preferred);

        return new SkillMatchResult(
            matchedRequired,
            missingRequired,
            matchedPreferred,
            ScoreMath.round(requiredRatio, 2),
            ScoreMath.round(preferredRatio, 2),
            ScoreMath.round(skillMatchScore, 2),
            ScoreMath.round(similarityScore(resume, jobSkills), 2)
        );
    }

    double similarityScore(List<String> resumeSkills, List<String> jobSkills) {
        if (resumeSkills.isEmpty() || jobSkills.isEmpty()) {
            return 0.0;
        }
        String resumeText = String.join(" ", resumeSkills);
        String jobText = String.join(" ", jobSkills);

        OptionalDouble tfidf = similarity.similarity(resumeText, jobText);
        if (tfidf.isPresent()) {
            return tfidf.getAsDouble();
        }
        log.debug("TF-IDF vocabulary empty for {} resume / {} job skills, using word overlap",
            resumeSkills.size(), jobSkills.size());
        return wordOverlap(resumeText, jobText);
    }

    static double wordOverlap(String resumeText, String jobText) {
        Set<String> resumeWords = words(resumeText);
        Set<String> jobWords = words(jobText);
        if (jobWords.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String word : jobWords) {
            if (resumeWords.contains(word)) {
                common++;
            }
        }
        return ScoreMath.ratio(common, jobWords.size());
    }

    private static Set<String> words(String text) {
        Set<String> out = new HashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!word.isEmpty()) {
                out.add(word);
            }
        }
        return out;
    }

    private static List<String> nonNull(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }
}
