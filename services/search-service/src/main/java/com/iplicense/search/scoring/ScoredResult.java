package com.iplicense.search.scoring;

public record ScoredResult(Candidate candidate, ScoreBreakdown scores) {
    public double composite() {
        return scores.composite();
    }
}
