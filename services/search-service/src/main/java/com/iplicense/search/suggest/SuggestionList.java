package com.iplicense.search.suggest;

import com.iplicense.search.query.EntityKind;
import java.util.List;

public record SuggestionList(String query, List<Suggestion> suggestions, List<EntityKind> unavailableEntities) {
    public static SuggestionList empty(String query) {
        return new SuggestionList(query, List.of(), List.of());
    }

    public SuggestionList {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        unavailableEntities = unavailableEntities == null ? List.of() : List.copyOf(unavailableEntities);
    }
}
