package com.delta.screener.screening.score;

import com.delta.screener.screening.match.SkillMatcher;
import com.delta.screener.screening.model.CompositeScore;
import com.delta.screener.screening.model.EducationLevel;
import com.delta.screener.screening.model.JobPostingRecord;
import com.delta.screener.screening.model.ResumeRecord;
import com.delta.screener.screening.model.SkillMatchResult;
import com.delta.screener.screening.util.ScoreMath;

/**
 * Weighted combination of skill, experience and education signals. Weights are fixed.
 */
public class ResumeScorer {
    static final double SKILL_WEIGHT = 0.5;
    static final double EXPERIENCE_WEIGHT = 0.3;
    static final double EDUCATION_WEIGHT = 0.2;

    static final double FULL_SCORE = 100.0;
    static final double UNKNOWN_EDUCATION_SCORE = 50.0;
    static final double ONE_LEVEL_BELOW_SCORE = 70.0;
    static final double FAR_BELOW_SCORE = 40.0;

    private final SkillMatcher skillMatcher;

    public ResumeScorer(SkillMatcher skillMatcher) {
        this.skillMatcher = skillMatcher;
    }

    public CompositeScore score(ResumeRecord resume, JobPostingRecord posting) {
        SkillMatchResult skillMatch = skillMatcher.match(
            resume.skills(),
            posting.requiredSkills(),
            posting.preferredSkills()
        );
        double experienceScore = experienceScore(resume.experienceYears(), posting.minExperienceYears());
        double educationScore = educationScore(resume.educationLevel(), posting.requiredEducation());

        double overall = skillMatch.skillMatchScore() * SKILL_WEIGHT
            + experienceScore * EXPERIENCE_WEIGHT
            + educationScore * EDUCATION_WEIGHT;

        return new CompositeScore(
            ScoreMath.clamp(ScoreMath.round(overall, 2), 0.0, FULL_SCORE),
            experienceScore,
            educationScore,
            skillMatch
        );
    }

    public static double experienceScore(Integer resumeYears, Integer requiredYears) {
        if (requiredYears == null) {
            return FULL_SCORE;
        }
        if (resumeYears == null) {
            return 0.0;
        }
        if (resumeYears >= requiredYears) {
            int excess = resumeYears - requiredYears;
            if (excess <= 2) {
                return FULL_SCORE;
            }
            if (excess <= 5) {
                return 95.0;
            }
            return 90.0;
        }
        return Math.max(0.0, FULL_SCORE * resumeYears / requiredYears);
    }

    public static double educationScore(EducationLevel resumeLevel, String requiredEducation) {
        if (requiredEducation == null || requiredEducation.isBlank()) {
            return FULL_SCORE;
        }
        if (resumeLevel == null) {
            return UNKNOWN_EDUCATION_SCORE;
        }
        int resumeRank = resumeLevel.rank();
        int requiredRank = EducationLevel.rankOf(requiredEducation);
        if (resumeRank >= requiredRank) {
            return FULL_SCORE;
        }
        if (resumeRank == requiredRank - 1) {
            return ONE_LEVEL_BELOW_SCORE;
        }
        return FAR_BELOW_SCORE;
    }
}
