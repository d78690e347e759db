package com.delta.screener.screening.parse;

import com.delta.screener.screening.model.EducationEntry;
import com.delta.screener.screening.model.EducationLevel;
import com.delta.screener.screening.model.ExperienceEntry;
import com.delta.screener.screening.model.ParsedFields;
import com.delta.screener.screening.nlp.AnalyzedText;
import com.delta.screener.screening.nlp.EntityLabel;
import com.delta.screener.screening.nlp.EntitySpan;
import com.delta.screener.screening.nlp.TextAnalyzer;
import com.delta.screener.screening.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ResumeFieldParser {
    private static final Logger log = LoggerFactory.getLogger(ResumeFieldParser.class);

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE =
        Pattern.compile("(\\+?\\d{1,3}[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");
    private static final Pattern EXPERIENCE_LINE = Pattern.compile("(?i)(?:work|experience|employment|career)");
    private static final Pattern EXPERIENCE_DATE = Pattern.compile("\\d{4}|\\d{1,2}[/-]\\d{4}");
    private static final Pattern DEGREE = Pattern.compile(
        "\\b(?:bachelor|master|phd|doctorate|diploma|mba)"
            + "|\\b(?:ph\\.d|b\\.?s|m\\.?s|b\\.?a|m\\.?a|b\\.?e)\\.?(?![a-z])",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final List<String> EDUCATION_KEYWORDS =
        List.of("university", "college", "degree", "bachelor", "master", "phd", "diploma");
    private static final int MAX_SKILL_PHRASE_TOKENS = 3;
    private static final int SUMMARY_SENTENCES = 3;
    private static final Comparator<String> SKILL_ORDER =
        String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private final TextAnalyzer analyzer;
    private final SkillVocabulary vocabulary;
    private final ExperienceYearsEstimator experienceYearsEstimator;
    private final EducationLevelDetector educationLevelDetector;

    public ResumeFieldParser(
        TextAnalyzer analyzer,
        SkillVocabulary vocabulary,
        ExperienceYearsEstimator experienceYearsEstimator,
        EducationLevelDetector educationLevelDetector
    ) {
        this.analyzer = analyzer;
        this.vocabulary = vocabulary;
        this.experienceYearsEstimator = experienceYearsEstimator;
        this.educationLevelDetector = educationLevelDetector;
    }

    public ParsedFields parse(String text) {
        if (text == null || text.isBlank()) {
            return new ParsedFields(null, null, null, List.of(), List.of(), List.of(), null, null, null);
        }
        AnalyzedText analyzed = analyzer.analyze(text);
        List<String> lines = TextUtils.lines(text);

        List<String> skills = extractSkills(analyzed, text);
        List<ExperienceEntry> experience = extractExperience(analyzed, lines);
        List<EducationEntry> education = extractEducation(analyzed, lines);
        Integer experienceYears = experienceYearsEstimator.estimate(text);
        EducationLevel educationLevel = educationLevelDetector.detect(text);

        log.debug(
            "Parsed resume: skills={} experienceEntries={} educationEntries={} experienceYears={} educationLevel={}",
            skills.size(),
            experience.size(),
            education.size(),
            experienceYears,
            educationLevel
        );
        return new ParsedFields(
            analyzed.firstEntity(EntityLabel.PERSON).map(EntitySpan::text).orElse(null),
            firstMatch(EMAIL, text),
            firstMatch(PHONE, text),
            skills,
            experience,
            education,
            summary(analyzed),
            experienceYears,
            educationLevel
        );
    }

    List<String> extractSkills(AnalyzedText analyzed, String text) {
        List<String> candidates = new ArrayList<>(vocabulary.findIn(text));
        for (String phrase : analyzed.segments().nounPhrases()) {
            if (phrase.trim().split("\\s+").length <= MAX_SKILL_PHRASE_TOKENS && vocabulary.mentionedIn(phrase)) {
                candidates.add(phrase.trim());
            }
        }
        Set<String> seen = new HashSet<>();
        List<String> skills = new ArrayList<>();
        for (String candidate : candidates) {
            if (seen.add(candidate.toLowerCase(Locale.ROOT))) {
                skills.add(candidate);
            }
        }
        skills.sort(SKILL_ORDER);
        return skills;
    }

    List<ExperienceEntry> extractExperience(AnalyzedText analyzed, List<String> lines) {
        List<ExperienceEntry> entries = new ArrayList<>();
        for (String line : lines) {
            if (!EXPERIENCE_LINE.matcher(line).find()) {
                continue;
            }
            ExperienceEntry entry = new ExperienceEntry(
                firstMatch(EXPERIENCE_DATE, line),
                analyzed.firstEntityWithin(EntityLabel.ORG, line).map(EntitySpan::text).orElse(null)
            );
            if (!entry.isEmpty()) {
                entries.add(entry);
            }
        }
        return entries;
    }

    List<EducationEntry> extractEducation(AnalyzedText analyzed, List<String> lines) {
        List<EducationEntry> entries = new ArrayList<>();
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (EDUCATION_KEYWORDS.stream().noneMatch(lower::contains)) {
                continue;
            }
            String degree = firstMatch(DEGREE, line);
            String institution = analyzed.firstEntityWithin(EntityLabel.ORG, line).map(EntitySpan::text).orElse(null);
            if (degree != null || institution != null) {
                entries.add(new EducationEntry(institution, degree, firstMatch(YEAR, line)));
            }
        }
        return entries;
    }

    private String summary(AnalyzedText analyzed) {
        List<String> sentences = analyzed.segments().sentences();
        if (sentences.isEmpty()) {
            return null;
        }
        return String.join(" ", sentences.subList(0, Math.min(SUMMARY_SENTENCES, sentences.size())));
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }
}
