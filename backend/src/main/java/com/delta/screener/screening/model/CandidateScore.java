package com.delta.screener.screening.model;

public record CandidateScore(
    Long resumeId,
    String candidateName,
    ScoreResult result
) {
    public double overallScore() {
        return result == null ? 0.0 : result.overallScore();
    }

    public Integer rank() {
        return result == null ? null : result.rank();
    }

    public CandidateScore withRank(int rank) {
        ScoreResult base = result == null ? ScoreResult.empty() : result;
        return new CandidateScore(resumeId, candidateName, base.withRank(rank));
    }
}
