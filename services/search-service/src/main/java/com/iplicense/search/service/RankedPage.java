package com.iplicense.search.service;

import com.iplicense.search.query.EntityKind;
import com.iplicense.search.scoring.ScoredResult;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record RankedPage(
    List<ScoredResult> results,
    int page,
    int pageSize,
    long total,
    int totalPages,
    Map<EntityKind, Long> entityCounts
) {
    public RankedPage {
        results = results == null ? List.of() : List.copyOf(results);
        entityCounts = entityCounts == null || entityCounts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(entityCounts));
    }

    public boolean hasNextPage() {
        return page < totalPages;
    }

    public boolean hasPreviousPage() {
        return page > 1;
    }
}
