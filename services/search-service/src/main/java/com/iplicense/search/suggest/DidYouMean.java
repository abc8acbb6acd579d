package com.iplicense.search.suggest;

import java.util.List;

/**
 * An alternative spelling for a query that found little. {@code alternatives} holds at most two runners-up.
 */
public record DidYouMean(boolean hasAlternative, SpellingSuggestion suggestion, List<SpellingSuggestion> alternatives) {
    public static final DidYouMean NONE = new DidYouMean(false, null, List.of());

    public DidYouMean {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
