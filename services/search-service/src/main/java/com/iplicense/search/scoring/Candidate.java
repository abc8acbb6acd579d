package com.iplicense.search.scoring;

import com.iplicense.search.query.EntityKind;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entity-agnostic projection of one matching record, produced by an entity adapter.
 *
 * <p>{@code sortMetrics} carries kind-specific sortable values keyed by sort field wire name
 * ({@code total_revenue}, {@code verified_at} as epoch millis, ...). {@code metadata} is passed through to the
 * response untouched.
 */
public record Candidate(
    EntityKind kind,
    String id,
    String title,
    String description,
    Instant createdAt,
    Instant updatedAt,
    PopularityVector popularity,
    QualityFlags quality,
    Map<String, Double> sortMetrics,
    Map<String, Object> metadata
) {
    public Candidate {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        popularity = popularity == null ? PopularityVector.NONE : popularity;
        quality = quality == null ? QualityFlags.NONE : quality;
        sortMetrics = sortMetrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sortMetrics));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Double sortMetric(String key) {
        return sortMetrics.get(key);
    }
}
