package com.iplicense.search.config;

import java.util.ArrayList;
import java.util.List;

final class SearchConfigValidator {
    private SearchConfigValidator() {
    }

    static void validate(SearchConfig.Builder builder) {
        List<String> errors = new ArrayList<>();
        SearchConfig.Weights weights = builder.getWeights();
        if (weights == null) {
            errors.add("weights are required");
        } else {
            if (weights.textual() < 0 || weights.recency() < 0 || weights.popularity() < 0 || weights.quality() < 0) {
                errors.add("weights must be non-negative");
            }
            if (weights.sum() <= 0.0) {
                errors.add("weights must not all be zero");
            }
        }
        if (!(builder.getHalfLifeDays() > 0.0)) {
            errors.add("recency.half_life_days must be positive");
        }
        if (!(builder.getMaxAgeDays() > 0.0)) {
            errors.add("recency.max_age_days must be positive");
        }
        SearchConfig.Popularity popularity = builder.getPopularity();
        if (popularity == null) {
            errors.add("popularity is required");
        } else {
            if (popularity.viewWeight() < 0 || popularity.usageWeight() < 0 || popularity.favoriteWeight() < 0) {
                errors.add("popularity weights must be non-negative");
            }
            if (popularity.viewWeight() + popularity.usageWeight() + popularity.favoriteWeight() <= 0.0) {
                errors.add("popularity weights must not all be zero");
            }
            if (popularity.viewSaturation() < 1 || popularity.usageSaturation() < 1 || popularity.favoriteSaturation() < 1) {
                errors.add("popularity saturation points must be at least 1");
            }
        }
        SearchConfig.Quality quality = builder.getQuality();
        if (quality == null) {
            errors.add("quality is required");
        } else if (quality.base() < 0 || quality.verified() < 0 || quality.active() < 0 || quality.approved() < 0) {
            errors.add("quality contributions must be non-negative");
        }
        if (builder.getMinQueryLength() < 1) {
            errors.add("parsing.min_query_length must be at least 1");
        }
        if (builder.getMaxQueryLength() < builder.getMinQueryLength()) {
            errors.add("parsing.max_query_length must be >= min_query_length");
        }
        if (builder.getPerEntityCap() < 1) {
            errors.add("limits.max_results_per_entity must be at least 1");
        }
        if (builder.getMaxPageSize() < 1) {
            errors.add("limits.max_page_size must be at least 1");
        }
        if (builder.getDefaultPageSize() < 1 || builder.getDefaultPageSize() > builder.getMaxPageSize()) {
            errors.add("limits.default_page_size must be within [1, max_page_size]");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("invalid search config: " + String.join("; ", errors));
        }
    }
}
