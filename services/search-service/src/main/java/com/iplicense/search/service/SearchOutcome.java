package com.iplicense.search.service;

import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.suggest.DidYouMean;
import java.util.List;

/**
 * @param didYouMean alternative spelling when the search found little; null otherwise
 */
public record SearchOutcome(
    SearchQuery query,
    RankedPage page,
    String eventId,
    List<EntityKind> unavailableEntities,
    long executionTimeMs,
    long configVersion,
    DidYouMean didYouMean
) {
    public SearchOutcome {
        unavailableEntities = unavailableEntities == null ? List.of() : List.copyOf(unavailableEntities);
    }

    public boolean isPartial() {
        return !unavailableEntities.isEmpty();
    }
}
