package com.delta.screener.screening.api;

import com.delta.screener.screening.model.CandidateScore;
import com.delta.screener.screening.model.ResumeRecord;
import com.delta.screener.screening.model.ScoreResult;
import com.delta.screener.screening.model.SkillMatchResult;
import com.delta.screener.screening.service.InvalidScreeningRequestException;
import com.delta.screener.screening.service.ScreeningService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ScreeningController {
    private final ScreeningService screeningService;

    public ScreeningController(ScreeningService screeningService) {
        this.screeningService = screeningService;
    }

    @PostMapping("/resumes/parse")
    public ResumeRecord parseResume(@RequestBody ResumeTextRequest request) {
        return screeningService.parseResume(request.resumeId(), request.text());
    }

    @PostMapping("/resumes/anonymize")
    public AnonymizedTextResponse anonymize(@RequestBody ResumeTextRequest request) {
        ResumeRecord resume = screeningService.parseResume(request.resumeId(), request.text());
        return new AnonymizedTextResponse(
            screeningService.anonymize(request.text()),
            screeningService.anonymizedFields(resume)
        );
    }

    @PostMapping("/screening")
    public ScoreResult screen(@RequestBody ScreeningRequest request) {
        return screeningService.screen(request.resume(), request.jobPosting());
    }

    @PostMapping("/screening/batch")
    public List<CandidateScore> screenBatch(@RequestBody BatchScreeningRequest request) {
        return screeningService.screenBatch(request.jobPosting(), request.resumes());
    }

    @PostMapping("/skills/match")
    public SkillMatchResult matchSkills(@RequestBody SkillMatchRequest request) {
        if (request.requiredSkills() == null) {
            throw new InvalidScreeningRequestException("required_skills is required");
        }
        return screeningService.matchSkills(request.resumeSkills(), request.requiredSkills(), request.preferredSkills());
    }
}
