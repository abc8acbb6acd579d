package com.iplicense.search.scoring;

public record ScoreBreakdown(
    double textual,
    double recency,
    double popularity,
    double quality,
    double composite
) {
}
