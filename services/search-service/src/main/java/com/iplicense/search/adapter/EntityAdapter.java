package com.iplicense.search.adapter;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.FacetField;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Fetches candidates of one entity kind. Implementations apply the caller's visibility rules and the
 * structural filters themselves; whatever they return is scored as-is.
 */
public interface EntityAdapter {
    EntityKind kind();

    /**
     * @param cap maximum number of candidates to return; the total count is not capped
     * @param timeout time left before the caller gives up on this kind; applied to every statement issued
     * @throws EntityAdapterException when the backing store cannot be queried
     */
    AdapterResult search(SearchQuery query, PermissionContext permissions, int cap, Duration timeout);

    /** Candidates only, without the total. */
    default List<Candidate> fetch(SearchQuery query, PermissionContext permissions, int limit, Duration timeout) {
        return search(query, permissions, limit, timeout).candidates();
    }

    /** Total matches only. */
    default long count(SearchQuery query, PermissionContext permissions, Duration timeout) {
        return search(query, permissions, 0, timeout).totalCount();
    }

    default Set<FacetField> facetFields() {
        return Set.of();
    }

    /**
     * Match counts per value of {@code field}, ignoring the query's own filter on that field.
     */
    default List<FacetCount> facetCounts(
        FacetField field,
        SearchQuery query,
        PermissionContext permissions,
        Duration timeout
    ) {
        return List.of();
    }

    /** Short secondary label shown under a suggestion. */
    default String subtitle(Candidate candidate) {
        return null;
    }
}
