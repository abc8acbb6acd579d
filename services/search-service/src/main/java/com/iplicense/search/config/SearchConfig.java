package com.iplicense.search.config;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable scoring and parsing configuration. One instance is used for the whole evaluation of a query;
 * reloads replace the instance, never its fields. Weight groups are normalized to sum to 1.0 on build.
 */
public final class SearchConfig {
    private final long version;
    private final Weights weights;
    private final double halfLifeDays;
    private final double maxAgeDays;
    private final Popularity popularity;
    private final Quality quality;
    private final int minQueryLength;
    private final int maxQueryLength;
    private final Set<String> stopWords;
    private final int perEntityCap;
    private final int defaultPageSize;
    private final int maxPageSize;

    private SearchConfig(Builder builder) {
        this.version = builder.version;
        this.weights = builder.weights.normalized();
        this.halfLifeDays = builder.halfLifeDays;
        this.maxAgeDays = builder.maxAgeDays;
        this.popularity = builder.popularity.normalized();
        this.quality = builder.quality;
        this.minQueryLength = builder.minQueryLength;
        this.maxQueryLength = builder.maxQueryLength;
        Set<String> words = new LinkedHashSet<>();
        for (String word : builder.stopWords) {
            if (word != null && !word.isBlank()) {
                words.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.stopWords = Set.copyOf(words);
        this.perEntityCap = builder.perEntityCap;
        this.defaultPageSize = builder.defaultPageSize;
        this.maxPageSize = builder.maxPageSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .version(version)
            .weights(weights)
            .halfLifeDays(halfLifeDays)
            .maxAgeDays(maxAgeDays)
            .popularity(popularity)
            .quality(quality)
            .minQueryLength(minQueryLength)
            .maxQueryLength(maxQueryLength)
            .stopWords(stopWords)
            .perEntityCap(perEntityCap)
            .defaultPageSize(defaultPageSize)
            .maxPageSize(maxPageSize);
    }

    public long getVersion() {
        return version;
    }

    public Weights getWeights() {
        return weights;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getMaxAgeDays() {
        return maxAgeDays;
    }

    public Popularity getPopularity() {
        return popularity;
    }

    public Quality getQuality() {
        return quality;
    }

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    public int getPerEntityCap() {
        return perEntityCap;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public record Weights(double textual, double recency, double popularity, double quality) {
        public double sum() {
            return textual + recency + popularity + quality;
        }

        Weights normalized() {
            double sum = sum();
            if (sum <= 0.0) {
                throw new IllegalStateException("scoring weights must not all be zero");
            }
            return new Weights(textual / sum, recency / sum, popularity / sum, quality / sum);
        }
    }

    /**
     * Popularity sub-weights plus the raw count at which each component reaches 1.0 on a log scale.
     */
    public record Popularity(
        double viewWeight,
        double usageWeight,
        double favoriteWeight,
        long viewSaturation,
        long usageSaturation,
        long favoriteSaturation
    ) {
        Popularity normalized() {
            double sum = viewWeight + usageWeight + favoriteWeight;
            if (sum <= 0.0) {
                throw new IllegalStateException("popularity weights must not all be zero");
            }
            return new Popularity(
                viewWeight / sum,
                usageWeight / sum,
                favoriteWeight / sum,
                viewSaturation,
                usageSaturation,
                favoriteSaturation
            );
        }
    }

    /** Additive contributions of the quality flags; the total is capped at 1.0. */
    public record Quality(double base, double verified, double active, double approved) {}

    public static final class Builder {
        private long version = 1L;
        private Weights weights = new Weights(0.5, 0.2, 0.2, 0.1);
        private double halfLifeDays = 90.0;
        private double maxAgeDays = 730.0;
        private Popularity popularity = new Popularity(0.5, 0.3, 0.2, 10_000L, 1_000L, 500L);
        private Quality quality = new Quality(0.2, 0.3, 0.25, 0.25);
        private int minQueryLength = 2;
        private int maxQueryLength = 200;
        private Set<String> stopWords = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by"
        );
        private int perEntityCap = 100;
        private int defaultPageSize = 20;
        private int maxPageSize = 100;

        private Builder() {
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder weights(Weights weights) {
            this.weights = weights;
            return this;
        }

        public Builder halfLifeDays(double halfLifeDays) {
            this.halfLifeDays = halfLifeDays;
            return this;
        }

        public Builder maxAgeDays(double maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
            return this;
        }

        public Builder popularity(Popularity popularity) {
            this.popularity = popularity;
            return this;
        }

        public Builder quality(Quality quality) {
            this.quality = quality;
            return this;
        }

        public Builder minQueryLength(int minQueryLength) {
            this.minQueryLength = minQueryLength;
            return this;
        }

        public Builder maxQueryLength(int maxQueryLength) {
            this.maxQueryLength = maxQueryLength;
            return this;
        }

        public Builder stopWords(Set<String> stopWords) {
            this.stopWords = stopWords == null ? Set.of() : stopWords;
            return this;
        }

        public Builder perEntityCap(int perEntityCap) {
            this.perEntityCap = perEntityCap;
            return this;
        }

        public Builder defaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
            return this;
        }

        public Builder maxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
            return this;
        }

        /**
         * Validates and builds the config.
         *
         * @throws IllegalStateException when any value is out of range
         */
        public SearchConfig build() {
            SearchConfigValidator.validate(this);
            return new SearchConfig(this);
        }

        Weights getWeights() {
            return weights;
        }

        double getHalfLifeDays() {
            return halfLifeDays;
        }

        double getMaxAgeDays() {
            return maxAgeDays;
        }

        Popularity getPopularity() {
            return popularity;
        }

        Quality getQuality() {
            return quality;
        }

        int getMinQueryLength() {
            return minQueryLength;
        }

        int getMaxQueryLength() {
            return maxQueryLength;
        }

        int getPerEntityCap() {
            return perEntityCap;
        }

        int getDefaultPageSize() {
            return defaultPageSize;
        }

        int getMaxPageSize() {
            return maxPageSize;
        }
    }
}
