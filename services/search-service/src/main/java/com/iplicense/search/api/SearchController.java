package com.iplicense.search.api;

import com.iplicense.search.analytics.AnalyticsRecorder;
import com.iplicense.search.analytics.SearchAnalyticsService;
import com.iplicense.search.analytics.dto.RecentSearch;
import com.iplicense.search.api.dto.AckResponse;
import com.iplicense.search.api.dto.ClickRequest;
import com.iplicense.search.api.dto.FacetsResponse;
import com.iplicense.search.api.dto.SearchRequest;
import com.iplicense.search.api.dto.SearchResponse;
import com.iplicense.search.api.dto.SpellingResponse;
import com.iplicense.search.api.dto.SuggestionsResponse;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.common.RequestContext;
import com.iplicense.search.common.RequestContextHolder;
import com.iplicense.search.facet.FacetService;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.service.SearchOutcome;
import com.iplicense.search.service.UnifiedSearchService;
import com.iplicense.search.suggest.SpellingService;
import com.iplicense.search.suggest.SuggestionService;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final UnifiedSearchService searchService;
    private final AnalyticsRecorder analyticsRecorder;
    private final SearchAnalyticsService analyticsService;
    private final SuggestionService suggestionService;
    private final SpellingService spellingService;
    private final FacetService facetService;

    public SearchController(
        UnifiedSearchService searchService,
        AnalyticsRecorder analyticsRecorder,
        SearchAnalyticsService analyticsService,
        SuggestionService suggestionService,
        SpellingService spellingService,
        FacetService facetService
    ) {
        this.searchService = searchService;
        this.analyticsRecorder = analyticsRecorder;
        this.analyticsService = analyticsService;
        this.suggestionService = suggestionService;
        this.spellingService = spellingService;
        this.facetService = facetService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public SearchResponse search(@RequestBody(required = false) SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        PermissionContext permissions = RequestContextHolder.permissions();
        SearchOutcome outcome = searchService.search(SearchApiMapper.toCommand(request), permissions);
        RequestContext context = RequestContextHolder.get();
        return SearchApiMapper.toResponse(
            outcome,
            context == null ? null : context.getTraceId(),
            context == null ? null : context.getRequestId()
        );
    }

    @PostMapping("/search/click")
    public AckResponse click(@RequestBody(required = false) ClickRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        if (request.getResultPosition() == null) {
            throw new InvalidSearchRequestException("resultPosition is required");
        }
        EntityKind kind = null;
        if (request.getResultEntityKind() != null) {
            kind = EntityKind.from(request.getResultEntityKind());
            if (kind == null) {
                throw new InvalidSearchRequestException("unknown resultEntityKind: " + request.getResultEntityKind());
            }
        }
        analyticsRecorder.attachClick(request.getEventId(), request.getResultId(), request.getResultPosition(), kind);
        RequestContext context = RequestContextHolder.get();
        return new AckResponse(
            "ok",
            context == null ? null : context.getTraceId(),
            context == null ? null : context.getRequestId()
        );
    }

    @GetMapping("/search/recent")
    public List<RecentSearch> recent(@RequestParam(value = "limit", defaultValue = "10") int limit) {
        return analyticsService.recentSearches(RequestContextHolder.permissions().userId(), limit);
    }

    @GetMapping("/search/suggestions")
    public SuggestionsResponse suggestions(
        @RequestParam(value = "q", required = false) String query,
        @RequestParam(value = "entities", required = false) String entities,
        @RequestParam(value = "limit", required = false) Integer limit
    ) {
        RequestContext context = RequestContextHolder.get();
        return SearchApiMapper.toResponse(
            suggestionService.suggest(query, splitEntities(entities), limit, RequestContextHolder.permissions()),
            context == null ? null : context.getTraceId(),
            context == null ? null : context.getRequestId()
        );
    }

    @GetMapping("/search/spelling")
    public SpellingResponse spelling(
        @RequestParam(value = "q", required = false) String query,
        @RequestParam(value = "currentResultCount", defaultValue = "0") long currentResultCount
    ) {
        if (query == null || query.isBlank()) {
            throw new InvalidSearchRequestException("q is required");
        }
        if (currentResultCount < 0) {
            throw new InvalidSearchRequestException("currentResultCount must be >= 0");
        }
        RequestContext context = RequestContextHolder.get();
        return SearchApiMapper.toResponse(
            spellingService.didYouMean(query.trim(), currentResultCount, RequestContextHolder.permissions()),
            context == null ? null : context.getTraceId(),
            context == null ? null : context.getRequestId()
        );
    }

    @PostMapping("/search/facets")
    public FacetsResponse facets(@RequestBody(required = false) SearchRequest request) {
        SearchRequest body = request == null ? new SearchRequest() : request;
        RequestContext context = RequestContextHolder.get();
        return SearchApiMapper.toResponse(
            facetService.facets(
                body.getQuery(),
                body.getEntities(),
                SearchApiMapper.toFilters(body.getFilters()),
                RequestContextHolder.permissions()
            ),
            context == null ? null : context.getTraceId(),
            context == null ? null : context.getRequestId()
        );
    }

    private static List<String> splitEntities(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return Arrays.stream(raw.split(",")).map(String::trim).filter(part -> !part.isEmpty()).toList();
    }
}
