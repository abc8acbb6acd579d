package com.iplicense.search.suggest;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.suggest")
public class SuggestProperties {
    private int defaultLimit = 10;
    private int maxLimit = 20;
    private final Spelling spelling = new Spelling();

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public Spelling getSpelling() {
        return spelling;
    }

    public static class Spelling {
        private boolean enabled = true;
        private int maxResultCount = 5;
        private long refreshMinutes = 60L;
        private int assetSample = 5000;
        private int creatorSample = 2000;
        private int projectSample = 2000;
        private int querySample = 1000;
        private int queryLookbackDays = 30;
        private int candidatesPerWord = 5;
        private int maxEstimates = 10;
        private long budgetMs = 800L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** Searches returning more than this many results get no alternative. */
        public int getMaxResultCount() {
            return maxResultCount;
        }

        public void setMaxResultCount(int maxResultCount) {
            this.maxResultCount = maxResultCount;
        }

        public long getRefreshMinutes() {
            return refreshMinutes;
        }

        public void setRefreshMinutes(long refreshMinutes) {
            this.refreshMinutes = refreshMinutes;
        }

        public int getAssetSample() {
            return assetSample;
        }

        public void setAssetSample(int assetSample) {
            this.assetSample = assetSample;
        }

        public int getCreatorSample() {
            return creatorSample;
        }

        public void setCreatorSample(int creatorSample) {
            this.creatorSample = creatorSample;
        }

        public int getProjectSample() {
            return projectSample;
        }

        public void setProjectSample(int projectSample) {
            this.projectSample = projectSample;
        }

        public int getQuerySample() {
            return querySample;
        }

        public void setQuerySample(int querySample) {
            this.querySample = querySample;
        }

        public int getQueryLookbackDays() {
            return queryLookbackDays;
        }

        public void setQueryLookbackDays(int queryLookbackDays) {
            this.queryLookbackDays = queryLookbackDays;
        }

        public int getCandidatesPerWord() {
            return candidatesPerWord;
        }

        public void setCandidatesPerWord(int candidatesPerWord) {
            this.candidatesPerWord = candidatesPerWord;
        }

        /** Upper bound on corrected queries whose result count is estimated for one request. */
        public int getMaxEstimates() {
            return maxEstimates;
        }

        public void setMaxEstimates(int maxEstimates) {
            this.maxEstimates = maxEstimates;
        }

        public long getBudgetMs() {
            return budgetMs;
        }

        public void setBudgetMs(long budgetMs) {
            this.budgetMs = budgetMs;
        }
    }
}
