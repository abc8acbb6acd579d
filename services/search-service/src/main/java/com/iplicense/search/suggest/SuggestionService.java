package com.iplicense.search.suggest;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.config.SearchConfigService;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import com.iplicense.search.service.AdapterFanOut;
import com.iplicense.search.service.AdapterOutcome;
import com.iplicense.search.service.SearchCancelledException;
import com.iplicense.search.service.SearchUnavailableException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Type-ahead over every entity kind. Each kind contributes its newest matches; exact title matches sort
 * first, then titles starting with the query, then the rest in kind order.
 */
@Service
public class SuggestionService {
    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    private final QueryNormalizer normalizer;
    private final SearchConfigService configService;
    private final AdapterFanOut fanOut;
    private final SuggestProperties properties;

    public SuggestionService(
        QueryNormalizer normalizer,
        SearchConfigService configService,
        AdapterFanOut fanOut,
        SuggestProperties properties
    ) {
        this.normalizer = normalizer;
        this.configService = configService;
        this.fanOut = fanOut;
        this.properties = properties;
    }

    /**
     * @throws com.iplicense.search.query.InvalidSearchRequestException when an entity kind is unknown
     * @throws SearchUnavailableException when every requested adapter failed
     */
    public SuggestionList suggest(String rawText, List<String> entities, Integer limit, PermissionContext permissions) {
        long started = System.nanoTime();
        SearchConfig config = configService.current();
        String trimmed = rawText == null ? "" : rawText.trim();
        if (trimmed.length() < config.getMinQueryLength()) {
            return SuggestionList.empty(trimmed);
        }
        SearchQuery query = normalizer.normalize(trimmed, entities, null, 1, null, null, null, config);
        int resolvedLimit = clampLimit(limit);
        int perKind = (int) Math.ceil((double) resolvedLimit / query.getEntityKinds().size());
        PermissionContext caller = permissions == null ? PermissionContext.ANONYMOUS : permissions;

        Map<EntityKind, AdapterOutcome<List<Suggestion>>> outcomes;
        try {
            outcomes = fanOut.run(
                "suggest",
                query.getEntityKinds(),
                started,
                (adapter, budget) -> adapter.fetch(query, caller, perKind, budget)
                    .stream()
                    .map(candidate -> toSuggestion(candidate, adapter.subtitle(candidate)))
                    .toList()
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("suggestions cancelled while waiting for adapters", ex);
        }

        List<Suggestion> merged = new ArrayList<>();
        List<EntityKind> unavailable = new ArrayList<>();
        for (AdapterOutcome<List<Suggestion>> outcome : outcomes.values()) {
            if (outcome.isError()) {
                unavailable.add(outcome.getKind());
            } else {
                merged.addAll(outcome.getResult());
            }
        }
        if (!outcomes.isEmpty() && unavailable.size() == outcomes.size()) {
            throw new SearchUnavailableException(unavailable);
        }

        String needle = query.getNormalizedText();
        merged.sort(Comparator.comparingInt(suggestion -> matchRank(suggestion, needle)));
        List<Suggestion> suggestions = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Suggestion suggestion : merged) {
            if (suggestions.size() >= resolvedLimit) {
                break;
            }
            if (seen.add(suggestion.kind().value() + ":" + suggestion.id())) {
                suggestions.add(suggestion);
            }
        }
        log.debug(
            "suggest done query_len={} returned={} partial={} took_ms={}",
            needle.length(),
            suggestions.size(),
            !unavailable.isEmpty(),
            (System.nanoTime() - started) / 1_000_000L
        );
        return new SuggestionList(query.getText(), suggestions, unavailable);
    }

    private int clampLimit(Integer limit) {
        if (limit == null) {
            return properties.getDefaultLimit();
        }
        return Math.max(1, Math.min(limit, properties.getMaxLimit()));
    }

    private static int matchRank(Suggestion suggestion, String needle) {
        String title = suggestion.title() == null ? "" : suggestion.title().toLowerCase(Locale.ROOT);
        if (title.equals(needle)) {
            return 0;
        }
        return title.startsWith(needle) ? 1 : 2;
    }

    private static Suggestion toSuggestion(Candidate candidate, String subtitle) {
        Object thumbnail = candidate.kind() == EntityKind.ASSETS ? candidate.metadata().get("thumbnailUrl") : null;
        return new Suggestion(
            candidate.id(),
            candidate.title(),
            candidate.kind(),
            subtitle,
            thumbnail == null ? null : String.valueOf(thumbnail)
        );
    }
}
