package com.iplicense.search.analytics.dto;

import java.time.Instant;

public record RecentSearch(String query, Instant lastSearchedAt, long searchCount) {
}
