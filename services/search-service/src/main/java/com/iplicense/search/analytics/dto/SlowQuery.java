package com.iplicense.search.analytics.dto;

public record SlowQuery(String query, long executionTimeMs) {
}
