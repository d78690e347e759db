package com.delta.screener.screening.api;

import com.delta.screener.screening.model.JobPostingRecord;
import com.delta.screener.screening.model.ResumeRecord;

public record ScreeningRequest(
    ResumeRecord resume,
    JobPostingRecord jobPosting
) {
}
