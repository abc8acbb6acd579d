package com.iplicense.search.api.dto;

import java.time.Instant;
import java.util.Map;

public class SearchHit {
    private String id;
    private String entityType;
    private String title;
    private String description;
    private double relevanceScore;
    private ScoreBreakdown scoreBreakdown;
    private Map<String, String> highlights;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public double getRelevanceScore() {
        return relevanceScore;
    }

    public void setRelevanceScore(double relevanceScore) {
        this.relevanceScore = relevanceScore;
    }

    public ScoreBreakdown getScoreBreakdown() {
        return scoreBreakdown;
    }

    public void setScoreBreakdown(ScoreBreakdown scoreBreakdown) {
        this.scoreBreakdown = scoreBreakdown;
    }

    public Map<String, String> getHighlights() {
        return highlights;
    }

    public void setHighlights(Map<String, String> highlights) {
        this.highlights = highlights;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public static class ScoreBreakdown {
        private double textualRelevance;
        private double recencyScore;
        private double popularityScore;
        private double qualityScore;
        private double finalScore;

        public double getTextualRelevance() {
            return textualRelevance;
        }

        public void setTextualRelevance(double textualRelevance) {
            this.textualRelevance = textualRelevance;
        }

        public double getRecencyScore() {
            return recencyScore;
        }

        public void setRecencyScore(double recencyScore) {
            this.recencyScore = recencyScore;
        }

        public double getPopularityScore() {
            return popularityScore;
        }

        public void setPopularityScore(double popularityScore) {
            this.popularityScore = popularityScore;
        }

        public double getQualityScore() {
            return qualityScore;
        }

        public void setQualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
        }

        public double getFinalScore() {
            return finalScore;
        }

        public void setFinalScore(double finalScore) {
            this.finalScore = finalScore;
        }
    }
}
