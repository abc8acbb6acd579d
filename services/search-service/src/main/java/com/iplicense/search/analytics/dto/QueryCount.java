package com.iplicense.search.analytics.dto;

public record QueryCount(String query, long count, Double averageResultsCount) {
}
