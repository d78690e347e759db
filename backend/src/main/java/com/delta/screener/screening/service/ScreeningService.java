package com.delta.screener.screening.service;

import com.delta.screener.config.ScreeningProperties;
import com.delta.screener.screening.bias.BiasReducer;
import com.delta.screener.screening.match.SkillMatcher;
import com.delta.screener.screening.model.CandidateScore;
import com.delta.screener.screening.model.CompositeScore;
import com.delta.screener.screening.model.JobPostingRecord;
import com.delta.screener.screening.model.ParsedFields;
import com.delta.screener.screening.model.ResumeRecord;
import com.delta.screener.screening.model.ScoreResult;
import com.delta.screener.screening.model.SkillMatchResult;
import com.delta.screener.screening.parse.ResumeFieldParser;
import com.delta.screener.screening.rank.CandidateRanker;
import com.delta.screener.screening.score.ResumeScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class ScreeningService {
    private static final Logger log = LoggerFactory.getLogger(ScreeningService.class);

    private final ScreeningProperties properties;
    private final ResumeFieldParser parser;
    private final SkillMatcher skillMatcher;
    private final ResumeScorer scorer;
    private final BiasReducer biasReducer;
    private final CandidateRanker ranker;
    private final ExecutorService screeningExecutor;

    public ScreeningService(
        ScreeningProperties properties,
        ResumeFieldParser parser,
        SkillMatcher skillMatcher,
        ResumeScorer scorer,
        BiasReducer biasReducer,
        CandidateRanker ranker,
        @Qualifier("screeningExecutor") ExecutorService screeningExecutor
    ) {
        this.properties = properties;
        this.parser = parser;
        this.skillMatcher = skillMatcher;
        this.scorer = scorer;
        this.biasReducer = biasReducer;
        this.ranker = ranker;
        this.screeningExecutor = screeningExecutor;
    }

    public ResumeRecord parseResume(Long resumeId, String text) {
        requireScreenableText(text);
        ParsedFields parsed = parser.parse(text);
        return ResumeRecord.fromParsed(resumeId, text, parsed);
    }

    public ParsedFields anonymizedFields(ResumeRecord resume) {
        return biasReducer.filterIdentifiers(resume.parsedFields());
    }

    public String anonymize(String text) {
        requireScreenableText(text);
        return biasReducer.anonymize(text);
    }

    public SkillMatchResult matchSkills(List<String> resumeSkills, List<String> required, List<String> preferred) {
        return skillMatcher.match(resumeSkills, required, preferred);
    }

    public ScoreResult screen(ResumeRecord resume, JobPostingRecord posting) {
        if (resume == null) {
            throw new InvalidScreeningRequestException("resume is required");
        }
        if (posting == null) {
            throw new InvalidScreeningRequestException("job_posting is required");
        }
        CompositeScore composite = scorer.score(resume, posting);
        double biasScore = biasReducer.biasScore(resume.originalText());
        double anonymizedScore = biasReducer.adjustedScore(composite.overallScore(), biasScore);
        return ScoreResult.of(composite, biasScore, anonymizedScore);
    }

    public List<CandidateScore> screenBatch(JobPostingRecord posting, List<ResumeRecord> resumes) {
        if (posting == null) {
            throw new InvalidScreeningRequestException("job_posting is required");
        }
        if (resumes == null || resumes.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<ScoreResult>> futures = new ArrayList<>();
        for (ResumeRecord resume : resumes) {
            futures.add(CompletableFuture.supplyAsync(() -> screen(resume, posting), screeningExecutor));
        }

        List<CandidateScore> results = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            ResumeRecord resume = resumes.get(i);
            Long resumeId = resume == null ? null : resume.id();
            String candidateName = resume == null ? null : resume.candidateName();
            try {
                results.add(new CandidateScore(resumeId, candidateName, futures.get(i).join()));
            } catch (CompletionException e) {
                failed++;
                log.warn("Screening failed for resume {} against posting {}", resumeId, posting.id(), e.getCause());
                results.add(new CandidateScore(resumeId, candidateName, ScoreResult.empty()));
            }
        }

        List<CandidateScore> ranked = ranker.rank(results);
        log.info(
            "Screened {} resumes against posting {} (failed={}, top score={})",
            ranked.size(),
            posting.id(),
            failed,
            ranked.isEmpty() ? null : ranked.get(0).overallScore()
        );
        return ranked;
    }

    public void requireScreenableText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidResumeTextException("Resume text is empty");
        }
        int minLength = properties.getMinTextLength();
        if (text.trim().length() < minLength) {
            throw new InvalidResumeTextException(
                "Resume text is too short (" + text.trim().length() + " < " + minLength + " characters)"
            );
        }
    }
}
