package com.iplicense.search.analytics.dto;

/** {@code growth} is the percentage change against the previous window of equal length. */
public record TrendingQuery(String query, long count, long previousCount, double growth) {
}
