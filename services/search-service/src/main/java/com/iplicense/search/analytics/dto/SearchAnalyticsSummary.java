package com.iplicense.search.analytics.dto;

import java.time.Instant;
import java.util.List;

public record SearchAnalyticsSummary(
    Instant from,
    Instant to,
    long totalSearches,
    double averageExecutionTimeMs,
    double averageResultsCount,
    double zeroResultsRate,
    double clickThroughRate,
    List<QueryCount> topQueries,
    List<EntitySearchCount> topEntities,
    List<QueryCount> zeroResultQueries
) {
}
