package com.iplicense.search.analytics.dto;

import java.util.List;

public record PerformanceMetrics(
    double averageExecutionTimeMs,
    long p50ExecutionTimeMs,
    long p95ExecutionTimeMs,
    long p99ExecutionTimeMs,
    List<SlowQuery> slowestQueries
) {
    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0.0, 0L, 0L, 0L, List.of());
    }
}
