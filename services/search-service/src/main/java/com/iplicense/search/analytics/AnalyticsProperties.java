package com.iplicense.search.analytics;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.analytics")
public class AnalyticsProperties {
    private boolean enabled = true;
    private int queueCapacity = 1000;
    private int drainBatchSize = 50;
    private long pollIntervalMs = 250L;
    private int maxWindowEvents = 50_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getDrainBatchSize() {
        return drainBatchSize;
    }

    public void setDrainBatchSize(int drainBatchSize) {
        this.drainBatchSize = drainBatchSize;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    /** Upper bound on events loaded for one admin view. */
    public int getMaxWindowEvents() {
        return maxWindowEvents;
    }

    public void setMaxWindowEvents(int maxWindowEvents) {
        this.maxWindowEvents = maxWindowEvents;
    }
}
