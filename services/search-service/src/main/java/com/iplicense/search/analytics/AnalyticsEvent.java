package com.iplicense.search.analytics;

import com.iplicense.search.query.EntityKind;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One completed (or degraded) search. Append-only apart from the click fields.
 */
public record AnalyticsEvent(
    String id,
    String query,
    List<EntityKind> entities,
    Map<String, Object> filters,
    int resultsCount,
    long executionTimeMs,
    String userId,
    String sessionId,
    Outcome outcome,
    ClickAttachment click,
    Instant createdAt
) {
    public enum Outcome {
        COMPLETE,
        PARTIAL,
        CANCELLED
    }

    public AnalyticsEvent {
        entities = entities == null ? List.of() : List.copyOf(entities);
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        outcome = outcome == null ? Outcome.COMPLETE : outcome;
    }

    public AnalyticsEvent withClick(ClickAttachment attachment) {
        return new AnalyticsEvent(
            id,
            query,
            entities,
            filters,
            resultsCount,
            executionTimeMs,
            userId,
            sessionId,
            outcome,
            attachment,
            createdAt
        );
    }

    public boolean hasClick() {
        return click != null;
    }
}
