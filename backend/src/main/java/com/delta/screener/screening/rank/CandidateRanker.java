package com.delta.screener.screening.rank;

import com.delta.screener.screening.model.CandidateScore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CandidateRanker {
    private static final Comparator<CandidateScore> BY_SCORE_DESC =
        Comparator.comparingDouble(CandidateScore::overallScore).reversed();

    /**
     * Returns a new list sorted by overall score, highest first, with ranks 1..N by position.
     * Equal scores keep their input order and still get distinct ranks.
     */
    public List<CandidateScore> rank(List<CandidateScore> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<CandidateScore> sorted = new ArrayList<>(candidates);
        sorted.sort(BY_SCORE_DESC);
        List<CandidateScore> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
