package com.iplicense.search.query;

import com.iplicense.search.config.SearchConfig;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class QueryNormalizer {
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s\\-_.,:;/#+@!?()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_BOUNDARY = Pattern.compile("[^\\p{L}\\p{M}\\p{N}]+");
    private static final Set<String> AVAILABILITY_STATUSES = Set.of("available", "limited", "unavailable");

    public SearchQuery normalize(
        String rawText,
        List<String> entities,
        SearchFilters filters,
        Integer page,
        Integer pageSize,
        String sortBy,
        String sortOrder,
        SearchConfig config
    ) {
        String text = normalizeText(rawText, config);
        List<String> tokens = tokenize(text, config.getStopWords());
        Set<EntityKind> kinds = resolveKinds(entities);
        SearchFilters validatedFilters = validateFilters(filters);

        int resolvedPage = page == null ? 1 : page;
        if (resolvedPage < 1) {
            throw new InvalidSearchRequestException("page must be >= 1");
        }
        int resolvedPageSize = pageSize == null
            ? config.getDefaultPageSize()
            : clamp(pageSize, 1, config.getMaxPageSize());

        SortField field = SortField.from(sortBy);
        SortDirective sort = new SortDirective(field, SortOrder.from(sortOrder));

        return new SearchQuery(text, tokens, kinds, validatedFilters, resolvedPage, resolvedPageSize, sort);
    }

    /**
     * Facet requests may omit the text. Text shorter than the minimum length is treated as absent, so only
     * visibility and filters narrow the counts.
     */
    public SearchQuery normalizeForFacets(
        String rawText,
        List<String> entities,
        SearchFilters filters,
        SearchConfig config
    ) {
        Set<EntityKind> kinds = resolveKinds(entities);
        SearchFilters validatedFilters = validateFilters(filters);
        if (rawText == null || rawText.trim().length() < config.getMinQueryLength()) {
            return SearchQuery.browse(kinds, validatedFilters);
        }
        String text = normalizeText(rawText, config);
        List<String> tokens = tokenize(text, config.getStopWords());
        return new SearchQuery(text, tokens, kinds, validatedFilters, 1, config.getDefaultPageSize(), null);
    }

    /**
     * Trims, bounds and sanitizes the raw text. Length bounds apply to the trimmed input; characters outside
     * the allow-list are then removed and whitespace collapsed.
     */
    public String normalizeText(String rawText, SearchConfig config) {
        String trimmed = rawText == null ? "" : rawText.trim();
        if (trimmed.length() < config.getMinQueryLength()) {
            throw new InvalidSearchRequestException(
                "query must be at least " + config.getMinQueryLength() + " characters"
            );
        }
        if (trimmed.length() > config.getMaxQueryLength()) {
            throw new InvalidSearchRequestException(
                "query must be at most " + config.getMaxQueryLength() + " characters"
            );
        }
        String sanitized = DISALLOWED.matcher(trimmed).replaceAll("");
        sanitized = WHITESPACE.matcher(sanitized).replaceAll(" ").trim();
        if (sanitized.length() < config.getMinQueryLength()) {
            throw new InvalidSearchRequestException("query has too few searchable characters");
        }
        return sanitized;
    }

    public List<String> tokenize(String text, Set<String> stopWords) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String part : TOKEN_BOUNDARY.split(text.toLowerCase(Locale.ROOT))) {
            if (part.isEmpty() || stopWords.contains(part)) {
                continue;
            }
            tokens.add(part);
        }
        return tokens;
    }

    private Set<EntityKind> resolveKinds(List<String> entities) {
        if (entities == null || entities.isEmpty()) {
            return EnumSet.allOf(EntityKind.class);
        }
        Set<EntityKind> kinds = EnumSet.noneOf(EntityKind.class);
        List<String> unknown = new ArrayList<>();
        for (String raw : entities) {
            EntityKind kind = EntityKind.from(raw);
            if (kind == null) {
                unknown.add(String.valueOf(raw));
            } else {
                kinds.add(kind);
            }
        }
        if (!unknown.isEmpty()) {
            throw new InvalidSearchRequestException("unknown entity kinds: " + String.join(", ", unknown));
        }
        return kinds;
    }

    private SearchFilters validateFilters(SearchFilters filters) {
        if (filters == null) {
            return SearchFilters.NONE;
        }
        String availability = filters.getAvailabilityStatus();
        if (availability != null && !AVAILABILITY_STATUSES.contains(availability)) {
            throw new InvalidSearchRequestException("availabilityStatus must be one of available, limited, unavailable");
        }
        if (filters.getDateFrom() != null && filters.getDateTo() != null
            && filters.getDateFrom().isAfter(filters.getDateTo())) {
            throw new InvalidSearchRequestException("dateFrom must not be after dateTo");
        }
        return filters;
    }

    private int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
