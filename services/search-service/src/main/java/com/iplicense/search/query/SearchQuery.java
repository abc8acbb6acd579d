package com.iplicense.search.query;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized, immutable search request. Together with a candidate universe, a {@code SearchConfig} and a
 * reference time it fully determines scoring and ordering.
 */
public final class SearchQuery {
    private final String text;
    private final String normalizedText;
    private final List<String> tokens;
    private final Set<EntityKind> entityKinds;
    private final SearchFilters filters;
    private final int page;
    private final int pageSize;
    private final SortDirective sort;

    public SearchQuery(
        String text,
        List<String> tokens,
        Set<EntityKind> entityKinds,
        SearchFilters filters,
        int page,
        int pageSize,
        SortDirective sort
    ) {
        this(text, tokens, entityKinds, filters, page, pageSize, sort, false);
    }

    private SearchQuery(
        String text,
        List<String> tokens,
        Set<EntityKind> entityKinds,
        SearchFilters filters,
        int page,
        int pageSize,
        SortDirective sort,
        boolean browse
    ) {
        if (!browse && (text == null || text.isBlank())) {
            throw new IllegalArgumentException("text is required");
        }
        if (entityKinds == null || entityKinds.isEmpty()) {
            throw new IllegalArgumentException("entityKinds must not be empty");
        }
        this.text = browse ? "" : text;
        this.normalizedText = this.text.toLowerCase(Locale.ROOT);
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.entityKinds = Collections.unmodifiableSet(EnumSet.copyOf(entityKinds));
        this.filters = filters == null ? SearchFilters.NONE : filters;
        this.page = page;
        this.pageSize = pageSize;
        this.sort = sort == null ? SortDirective.RELEVANCE : sort;
    }

    /** A query without text: only visibility and filters narrow what matches. */
    public static SearchQuery browse(Set<EntityKind> entityKinds, SearchFilters filters) {
        return new SearchQuery("", List.of(), entityKinds, filters, 1, 1, null, true);
    }

    public SearchQuery withFilters(SearchFilters replacement) {
        return new SearchQuery(text, tokens, entityKinds, replacement, page, pageSize, sort, isBrowse());
    }

    public boolean isBrowse() {
        return text.isEmpty();
    }

    /** Sanitized query text with original casing, used for exact and substring matching. */
    public String getText() {
        return text;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    /** Lowercase word tokens with stop words removed. */
    public List<String> getTokens() {
        return tokens;
    }

    public Set<EntityKind> getEntityKinds() {
        return entityKinds;
    }

    public SearchFilters getFilters() {
        return filters;
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public SortDirective getSort() {
        return sort;
    }

    public int getOffset() {
        return (page - 1) * pageSize;
    }
}
