package com.delta.screener.screening.api;

import com.delta.screener.screening.model.JobPostingRecord;
import com.delta.screener.screening.model.ResumeRecord;

import java.util.List;

public record BatchScreeningRequest(
    JobPostingRecord jobPosting,
    List<ResumeRecord> resumes
) {
}
