package com.delta.screener.config;

import com.delta.screener.screening.bias.BiasPatternTable;
import com.delta.screener.screening.bias.BiasReducer;
import com.delta.screener.screening.match.SkillMatcher;
import com.delta.screener.screening.match.TfidfSimilarity;
import com.delta.screener.screening.nlp.HeuristicTextAnalyzer;
import com.delta.screener.screening.nlp.TextAnalyzer;
import com.delta.screener.screening.parse.EducationLevelDetector;
import com.delta.screener.screening.parse.ExperienceYearsEstimator;
import com.delta.screener.screening.parse.ResumeFieldParser;
import com.delta.screener.screening.parse.SkillVocabulary;
import com.delta.screener.screening.rank.CandidateRanker;
import com.delta.screener.screening.score.ResumeScorer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScreeningConfig {
    private static final Logger log = LoggerFactory.getLogger(ScreeningConfig.class);

    @Bean(name = "screeningExecutor", destroyMethod = "shutdown")
    public ExecutorService screeningExecutor(ScreeningProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatchConcurrency());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SkillVocabulary skillVocabulary(ScreeningProperties properties) {
        SkillVocabulary vocabulary = new SkillVocabulary(properties.getSkills().getKeywords());
        log.info("Loaded {} skill keywords", vocabulary.size());
        return vocabulary;
    }

    @Bean
    public TextAnalyzer textAnalyzer(SkillVocabulary vocabulary) {
        return new HeuristicTextAnalyzer(vocabulary.keywords());
    }

    @Bean
    public ResumeFieldParser resumeFieldParser(
        TextAnalyzer textAnalyzer,
        SkillVocabulary vocabulary,
        ScreeningProperties properties,
        Clock clock
    ) {
        return new ResumeFieldParser(
            textAnalyzer,
            vocabulary,
            new ExperienceYearsEstimator(clock, properties.getReferenceYear()),
            new EducationLevelDetector()
        );
    }

    @Bean
    public SkillMatcher skillMatcher() {
        return new SkillMatcher(new TfidfSimilarity());
    }

    @Bean
    public ResumeScorer resumeScorer(SkillMatcher skillMatcher) {
        return new ResumeScorer(skillMatcher);
    }

    @Bean
    public BiasPatternTable biasPatternTable(ScreeningProperties properties) {
        BiasPatternTable table = BiasPatternTable.fromProperties(properties.getBias());
        log.info("Loaded {} bias categories {}", table.categories().size(), table.categories().keySet());
        return table;
    }

    @Bean
    public BiasReducer biasReducer(BiasPatternTable biasPatternTable) {
        return new BiasReducer(biasPatternTable);
    }

    @Bean
    public CandidateRanker candidateRanker() {
        return new CandidateRanker();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
