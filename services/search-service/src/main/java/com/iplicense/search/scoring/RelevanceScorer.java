package com.iplicense.search.scoring;

import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.query.SearchQuery;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Pure relevance function: {@code (query, candidate, config, referenceTime) -> ScoredResult}.
 * Never reads the clock or shared state.
 */
public final class RelevanceScorer {
    static final double EXACT_MATCH = 1.0;
    static final double CONTAINS_MATCH = 0.7;
    static final double PARTIAL_TOKEN_CEILING = 0.5;
    static final double SECONDARY_BONUS = 0.3;

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private RelevanceScorer() {
    }

    public static ScoredResult score(SearchQuery query, Candidate candidate, SearchConfig config, Instant referenceTime) {
        double textual = textualScore(query.getNormalizedText(), query.getTokens(), candidate.title(), candidate.description());
        double recency = recencyScore(candidate.createdAt(), referenceTime, config.getHalfLifeDays(), config.getMaxAgeDays());
        double popularity = popularityScore(candidate.popularity(), config.getPopularity());
        double quality = qualityScore(candidate.quality(), config.getQuality());

        SearchConfig.Weights weights = config.getWeights();
        double composite = clamp(
            weights.textual() * textual
                + weights.recency() * recency
                + weights.popularity() * popularity
                + weights.quality() * quality
        );
        return new ScoredResult(candidate, new ScoreBreakdown(textual, recency, popularity, quality, composite));
    }

    /**
     * Exact primary match beats substring, substring beats partial tokens. Partial-token matches are scaled
     * below the substring tier so a full-coverage token match never ties an actual substring hit.
     */
    static double textualScore(String normalizedQuery, List<String> tokens, String primary, String secondary) {
        if (normalizedQuery == null || normalizedQuery.isEmpty()) {
            return 0.0;
        }
        String title = lower(primary);
        double score;
        if (title.equals(normalizedQuery)) {
            score = EXACT_MATCH;
        } else if (title.contains(normalizedQuery)) {
            score = CONTAINS_MATCH;
        } else if (tokens == null || tokens.isEmpty()) {
            score = 0.0;
        } else {
            int hits = 0;
            for (String token : tokens) {
                if (title.contains(token)) {
                    hits++;
                }
            }
            score = PARTIAL_TOKEN_CEILING * hits / tokens.size();
        }
        if (lower(secondary).contains(normalizedQuery)) {
            score += SECONDARY_BONUS;
        }
        return Math.min(1.0, score);
    }

    static double recencyScore(Instant createdAt, Instant referenceTime, double halfLifeDays, double maxAgeDays) {
        if (createdAt == null || referenceTime == null) {
            return 0.0;
        }
        double ageDays = Math.max(0.0, Duration.between(createdAt, referenceTime).toMillis() / MILLIS_PER_DAY);
        if (ageDays >= maxAgeDays) {
            return 0.0;
        }
        return clamp(Math.pow(0.5, ageDays / halfLifeDays));
    }

    static double popularityScore(PopularityVector vector, SearchConfig.Popularity popularity) {
        if (vector == null) {
            return 0.0;
        }
        double score = popularity.viewWeight() * saturate(vector.views(), popularity.viewSaturation())
            + popularity.usageWeight() * saturate(vector.usage(), popularity.usageSaturation())
            + popularity.favoriteWeight() * saturate(vector.favorites(), popularity.favoriteSaturation());
        return clamp(score);
    }

    static double qualityScore(QualityFlags flags, SearchConfig.Quality quality) {
        double score = quality.base();
        if (flags != null) {
            if (flags.verified()) {
                score += quality.verified();
            }
            if (flags.active()) {
                score += quality.active();
            }
            if (flags.approved()) {
                score += quality.approved();
            }
        }
        return clamp(score);
    }

    // log scale, reaches 1.0 at the saturation count
    private static double saturate(long count, long saturation) {
        if (count <= 0L) {
            return 0.0;
        }
        return Math.min(1.0, Math.log1p(count) / Math.log1p(saturation));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
