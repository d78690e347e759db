package com.delta.screener.screening.service;

import com.delta.screener.config.ScreeningProperties;
import com.delta.screener.screening.ResumeFixtures;
import com.delta.screener.screening.model.CandidateScore;
import com.delta.screener.screening.model.CompositeScore;
import com.delta.screener.screening.model.EducationLevel;
import com.delta.screener.screening.model.JobPostingRecord;
import com.delta.screener.screening.model.ResumeRecord;
import com.delta.screener.screening.model.ScoreResult;
import com.delta.screener.screening.model.SkillMatchResult;
import com.delta.screener.screening.rank.CandidateRanker;
import com.delta.screener.screening.score.ResumeScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScreeningServiceTest {

    @Mock
    private ResumeScorer mockScorer;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parseRejectsTextBelowMinimumLength() {
        ScreeningService service = createService(new ResumeScorer(ResumeFixtures.skillMatcher()));

        assertThatThrownBy(() -> service.parseResume(1L, "Too short to screen"))
            .isInstanceOf(InvalidResumeTextException.class)
            .hasMessageContaining("too short");
        assertThatThrownBy(() -> service.anonymize("   "))
            .isInstanceOf(InvalidResumeTextException.class);
    }

    @Test
    void parsedResumeCarriesDerivedFields() {
        ScreeningService service = createService(new ResumeScorer(ResumeFixtures.skillMatcher()));

        ResumeRecord resume = service.parseResume(42L, ResumeFixtures.SAMPLE_RESUME);

        assertThat(resume.id()).isEqualTo(42L);
        assertThat(resume.candidateName()).isEqualTo("John Smith");
        assertThat(resume.experienceYears()).isEqualTo(6);
        assertThat(resume.educationLevel()).isEqualTo(EducationLevel.BACHELORS);
        assertThat(resume.skills()).contains("Python", "Java", "Docker");
        assertThat(service.anonymizedFields(resume).name()).isNull();
        assertThat(service.anonymizedFields(resume).email()).isNull();
    }

    @Test
    void screenAddsBiasAdjustedScore() {
        ScreeningService service = createService(new ResumeScorer(ResumeFixtures.skillMatcher()));
        ResumeRecord resume = service.parseResume(1L, ResumeFixtures.SAMPLE_RESUME);
        JobPostingRecord posting = ResumeFixtures.posting(List.of("Python", "Java"), List.of("Docker"), 5, "Bachelor's");

        ScoreResult result = service.screen(resume, posting);

        assertThat(result.matchedSkills()).containsExactly("Python", "Java");
        assertThat(result.missingSkills()).isEmpty();
        assertThat(result.biasScore()).isEqualTo(0.125);
        assertThat(result.anonymizedScore()).isLessThan(result.overallScore());
        assertThat(result.rank()).isNull();
    }

    @Test
    void screenRequiresResumeAndPosting() {
        ScreeningService service = createService(new ResumeScorer(ResumeFixtures.skillMatcher()));
        JobPostingRecord posting = ResumeFixtures.posting(List.of("Python"), List.of(), null, null);

        assertThatThrownBy(() -> service.screen(null, posting))
            .isInstanceOf(InvalidScreeningRequestException.class);
        assertThatThrownBy(() -> service.screenBatch(null, List.of()))
            .isInstanceOf(InvalidScreeningRequestException.class);
    }

    @Test
    void batchIsolatesFailuresAndRanksEveryResume() {
        ScreeningService service = createService(mockScorer);
        when(mockScorer.score(any(), any())).thenAnswer(invocation -> {
            ResumeRecord resume = invocation.getArgument(0);
            if (resume.id() == 2L) {
                throw new IllegalStateException("scoring blew up");
            }
            return composite(resume.id() == 1L ? 60.0 : 80.0);
        });
        List<ResumeRecord> resumes = List.of(
            plainResume(1L),
            plainResume(2L),
            plainResume(3L)
        );

        List<CandidateScore> ranked = service.screenBatch(
            ResumeFixtures.posting(List.of("Python"), List.of(), null, null),
            resumes
        );

        assertThat(ranked).extracting(CandidateScore::resumeId).containsExactly(3L, 1L, 2L);
        assertThat(ranked).extracting(CandidateScore::rank).containsExactly(1, 2, 3);
        assertThat(ranked).extracting(CandidateScore::overallScore).containsExactly(80.0, 60.0, 0.0);
        assertThat(ranked.get(0).result().anonymizedScore()).isEqualTo(80.0);
    }

    @Test
    void emptyBatchYieldsEmptyRanking() {
        ScreeningService service = createService(new ResumeScorer(ResumeFixtures.skillMatcher()));

        assertThat(service.screenBatch(ResumeFixtures.posting(List.of("Python"), List.of(), null, null), List.of()))
            .isEmpty();
    }

    private ScreeningService createService(ResumeScorer scorer) {
        return new ScreeningService(
            new ScreeningProperties(),
            ResumeFixtures.parser(),
            ResumeFixtures.skillMatcher(),
            scorer,
            ResumeFixtures.biasReducer(),
            new CandidateRanker(),
            executor
        );
    }

    private static ResumeRecord plainResume(long id) {
        return ResumeFixtures.resume(id, "backend services in python, twelve deployments", List.of("Python"), 3, null);
    }

    private static CompositeScore composite(double overall) {
        SkillMatchResult match = new SkillMatchResult(List.of("Python"), List.of(), List.of(), 1.0, 0.0, 70.0, 1.0);
        return new CompositeScore(overall, 100.0, 100.0, match);
    }
}
