package com.iplicense.search.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.scoring")
public class ScoringProperties {
    private String configPath;
    private boolean strict = false;
    private Weights weights = new Weights();
    private Recency recency = new Recency();
    private Popularity popularity = new Popularity();
    private Quality quality = new Quality();
    private Parsing parsing = new Parsing();
    private Limits limits = new Limits();

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public Recency getRecency() {
        return recency;
    }

    public void setRecency(Recency recency) {
        this.recency = recency;
    }

    public Popularity getPopularity() {
        return popularity;
    }

    public void setPopularity(Popularity popularity) {
        this.popularity = popularity;
    }

    public Quality getQuality() {
        return quality;
    }

    public void setQuality(Quality quality) {
        this.quality = quality;
    }

    public Parsing getParsing() {
        return parsing;
    }

    public void setParsing(Parsing parsing) {
        this.parsing = parsing;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    /** Property defaults as a config builder; a YAML override is applied on top by the loader. */
    public SearchConfig.Builder toBuilder() {
        return SearchConfig.builder()
            .weights(new SearchConfig.Weights(
                weights.getTextual(),
                weights.getRecency(),
                weights.getPopularity(),
                weights.getQuality()
            ))
            .halfLifeDays(recency.getHalfLifeDays())
            .maxAgeDays(recency.getMaxAgeDays())
            .popularity(new SearchConfig.Popularity(
                popularity.getViewWeight(),
                popularity.getUsageWeight(),
                popularity.getFavoriteWeight(),
                popularity.getViewSaturation(),
                popularity.getUsageSaturation(),
                popularity.getFavoriteSaturation()
            ))
            .quality(new SearchConfig.Quality(
                quality.getBase(),
                quality.getVerified(),
                quality.getActive(),
                quality.getApproved()
            ))
            .minQueryLength(parsing.getMinQueryLength())
            .maxQueryLength(parsing.getMaxQueryLength())
            .stopWords(new LinkedHashSet<>(parsing.getStopWords()))
            .perEntityCap(limits.getMaxResultsPerEntity())
            .defaultPageSize(limits.getDefaultPageSize())
            .maxPageSize(limits.getMaxPageSize());
    }

    public static class Weights {
        private double textual = 0.5;
        private double recency = 0.2;
        private double popularity = 0.2;
        private double quality = 0.1;

        public double getTextual() {
            return textual;
        }

        public void setTextual(double textual) {
            this.textual = textual;
        }

        public double getRecency() {
            return recency;
        }

        public void setRecency(double recency) {
            this.recency = recency;
        }

        public double getPopularity() {
            return popularity;
        }

        public void setPopularity(double popularity) {
            this.popularity = popularity;
        }

        public double getQuality() {
            return quality;
        }

        public void setQuality(double quality) {
            this.quality = quality;
        }
    }

    public static class Recency {
        private double halfLifeDays = 90.0;
        private double maxAgeDays = 730.0;

        public double getHalfLifeDays() {
            return halfLifeDays;
        }

        public void setHalfLifeDays(double halfLifeDays) {
            this.halfLifeDays = halfLifeDays;
        }

        public double getMaxAgeDays() {
            return maxAgeDays;
        }

        public void setMaxAgeDays(double maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }
    }

    public static class Popularity {
        private double viewWeight = 0.5;
        private double usageWeight = 0.3;
        private double favoriteWeight = 0.2;
        private long viewSaturation = 10_000L;
        private long usageSaturation = 1_000L;
        private long favoriteSaturation = 500L;

        public double getViewWeight() {
            return viewWeight;
        }

        public void setViewWeight(double viewWeight) {
            this.viewWeight = viewWeight;
        }

        public double getUsageWeight() {
            return usageWeight;
        }

        public void setUsageWeight(double usageWeight) {
            this.usageWeight = usageWeight;
        }

        public double getFavoriteWeight() {
            return favoriteWeight;
        }

        public void setFavoriteWeight(double favoriteWeight) {
            this.favoriteWeight = favoriteWeight;
        }

        public long getViewSaturation() {
            return viewSaturation;
        }

        public void setViewSaturation(long viewSaturation) {
            this.viewSaturation = viewSaturation;
        }

        public long getUsageSaturation() {
            return usageSaturation;
        }

        public void setUsageSaturation(long usageSaturation) {
            this.usageSaturation = usageSaturation;
        }

        public long getFavoriteSaturation() {
            return favoriteSaturation;
        }

        public void setFavoriteSaturation(long favoriteSaturation) {
            this.favoriteSaturation = favoriteSaturation;
        }
    }

    public static class Quality {
        private double base = 0.2;
        private double verified = 0.3;
        private double active = 0.25;
        private double approved = 0.25;

        public double getBase() {
            return base;
        }

        public void setBase(double base) {
            this.base = base;
        }

        public double getVerified() {
            return verified;
        }

        public void setVerified(double verified) {
            this.verified = verified;
        }

        public double getActive() {
            return active;
        }

        public void setActive(double active) {
            this.active = active;
        }

        public double getApproved() {
            return approved;
        }

        public void setApproved(double approved) {
            this.approved = approved;
        }
    }

    public static class Parsing {
        private int minQueryLength = 2;
        private int maxQueryLength = 200;
        private List<String> stopWords = new ArrayList<>(List.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by"
        ));

        public int getMinQueryLength() {
            return minQueryLength;
        }

        public void setMinQueryLength(int minQueryLength) {
            this.minQueryLength = minQueryLength;
        }

        public int getMaxQueryLength() {
            return maxQueryLength;
        }

        public void setMaxQueryLength(int maxQueryLength) {
            this.maxQueryLength = maxQueryLength;
        }

        public List<String> getStopWords() {
            return stopWords;
        }

        public void setStopWords(List<String> stopWords) {
            this.stopWords = stopWords;
        }
    }

    public static class Limits {
        private int maxResultsPerEntity = 100;
        private int defaultPageSize = 20;
        private int maxPageSize = 100;

        public int getMaxResultsPerEntity() {
            return maxResultsPerEntity;
        }

        public void setMaxResultsPerEntity(int maxResultsPerEntity) {
            this.maxResultsPerEntity = maxResultsPerEntity;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }
}
