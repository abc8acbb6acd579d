package com.iplicense.search.facet;

import com.iplicense.search.query.EntityKind;
import java.util.List;

/**
 * @param totalResults matches for the query and all filters across the kinds that answered
 */
public record FacetsOutcome(List<FacetGroup> groups, long totalResults, List<EntityKind> unavailableEntities) {
    public FacetsOutcome {
        groups = groups == null ? List.of() : List.copyOf(groups);
        unavailableEntities = unavailableEntities == null ? List.of() : List.copyOf(unavailableEntities);
    }
}
