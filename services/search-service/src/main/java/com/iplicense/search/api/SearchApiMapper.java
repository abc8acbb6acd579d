package com.iplicense.search.api;

import com.iplicense.search.api.dto.FacetsResponse;
import com.iplicense.search.api.dto.SearchHit;
import com.iplicense.search.api.dto.SearchRequest;
import com.iplicense.search.api.dto.SearchResponse;
import com.iplicense.search.api.dto.SpellingResponse;
import com.iplicense.search.api.dto.SuggestionsResponse;
import com.iplicense.search.facet.FacetGroup;
import com.iplicense.search.facet.FacetOption;
import com.iplicense.search.facet.FacetsOutcome;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.scoring.Candidate;
import com.iplicense.search.scoring.HighlightGenerator;
import com.iplicense.search.scoring.ScoreBreakdown;
import com.iplicense.search.scoring.ScoredResult;
import com.iplicense.search.service.RankedPage;
import com.iplicense.search.service.SearchCommand;
import com.iplicense.search.service.SearchOutcome;
import com.iplicense.search.suggest.DidYouMean;
import com.iplicense.search.suggest.Suggestion;
import com.iplicense.search.suggest.SuggestionList;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SearchApiMapper {
    private SearchApiMapper() {
    }

    static SearchCommand toCommand(SearchRequest request) {
        return new SearchCommand(
            request.getQuery(),
            request.getEntities(),
            toFilters(request.getFilters()),
            request.getPage(),
            request.getPageSize(),
            request.getSortBy(),
            request.getSortOrder()
        );
    }

    static SearchFilters toFilters(SearchRequest.Filters filters) {
        if (filters == null) {
            return SearchFilters.NONE;
        }
        return SearchFilters.builder()
            .assetTypes(filters.getAssetType())
            .assetStatuses(filters.getAssetStatus())
            .projectId(filters.getProjectId())
            .creatorId(filters.getCreatorId())
            .tags(filters.getTags())
            .createdBy(filters.getCreatedBy())
            .verificationStatuses(filters.getVerificationStatus())
            .specialties(filters.getSpecialties())
            .industries(filters.getIndustry())
            .categories(filters.getCategory())
            .country(filters.getCountry())
            .region(filters.getRegion())
            .city(filters.getCity())
            .availabilityStatus(filters.getAvailabilityStatus())
            .projectTypes(filters.getProjectType())
            .projectStatuses(filters.getProjectStatus())
            .brandId(filters.getBrandId())
            .licenseTypes(filters.getLicenseType())
            .licenseStatuses(filters.getLicenseStatus())
            .dateFrom(parseInstant("dateFrom", filters.getDateFrom()))
            .dateTo(parseInstant("dateTo", filters.getDateTo()))
            .build();
    }

    /** Accepts an ISO-8601 instant or a plain date (start of day, UTC). */
    static Instant parseInstant(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ex) {
                throw new InvalidSearchRequestException(name + " must be an ISO-8601 date or instant");
            }
        }
    }

    static SearchResponse toResponse(SearchOutcome outcome, String traceId, String requestId) {
        RankedPage page = outcome.page();
        String queryText = outcome.query().getText();

        List<SearchHit> hits = new ArrayList<>(page.results().size());
        for (ScoredResult result : page.results()) {
            hits.add(toHit(result, queryText));
        }

        SearchResponse.Pagination pagination = new SearchResponse.Pagination();
        pagination.setPage(page.page());
        pagination.setPageSize(page.pageSize());
        pagination.setTotal(page.total());
        pagination.setTotalPages(page.totalPages());
        pagination.setHasNextPage(page.hasNextPage());
        pagination.setHasPreviousPage(page.hasPreviousPage());

        Map<String, Long> entityCounts = new LinkedHashMap<>();
        page.entityCounts().forEach((kind, count) -> entityCounts.put(kind.value(), count));
        SearchResponse.Facets facets = new SearchResponse.Facets();
        facets.setEntityCounts(entityCounts);

        SearchResponse response = new SearchResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setResults(hits);
        response.setPagination(pagination);
        response.setFacets(facets);
        response.setQuery(queryText);
        response.setExecutionTimeMs(outcome.executionTimeMs());
        response.setEventId(outcome.eventId());
        response.setPartial(outcome.isPartial());
        response.setUnavailableEntities(outcome.unavailableEntities().stream().map(EntityKind::value).toList());
        response.setDidYouMean(outcome.didYouMean());
        return response;
    }

    static SuggestionsResponse toResponse(SuggestionList list, String traceId, String requestId) {
        List<SuggestionsResponse.Item> items = new ArrayList<>(list.suggestions().size());
        for (Suggestion suggestion : list.suggestions()) {
            SuggestionsResponse.Item item = new SuggestionsResponse.Item();
            item.setId(suggestion.id());
            item.setTitle(suggestion.title());
            item.setType(suggestion.kind().value());
            item.setSubtitle(suggestion.subtitle());
            item.setThumbnailUrl(suggestion.thumbnailUrl());
            items.add(item);
        }
        SuggestionsResponse response = new SuggestionsResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setQuery(list.query());
        response.setSuggestions(items);
        response.setPartial(!list.unavailableEntities().isEmpty());
        response.setUnavailableEntities(list.unavailableEntities().stream().map(EntityKind::value).toList());
        return response;
    }

    static SpellingResponse toResponse(DidYouMean didYouMean, String traceId, String requestId) {
        SpellingResponse response = new SpellingResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setHasAlternative(didYouMean.hasAlternative());
        response.setSuggestion(didYouMean.suggestion());
        response.setAlternatives(didYouMean.alternatives());
        return response;
    }

    static FacetsResponse toResponse(FacetsOutcome outcome, String traceId, String requestId) {
        List<FacetsResponse.Group> groups = new ArrayList<>(outcome.groups().size());
        for (FacetGroup group : outcome.groups()) {
            List<FacetsResponse.Option> options = new ArrayList<>(group.options().size());
            for (FacetOption option : group.options()) {
                FacetsResponse.Option dto = new FacetsResponse.Option();
                dto.setValue(option.value());
                dto.setLabel(option.label());
                dto.setCount(option.count());
                dto.setSelected(option.selected());
                options.add(dto);
            }
            FacetsResponse.Group dto = new FacetsResponse.Group();
            dto.setField(group.field().value());
            dto.setLabel(group.label());
            dto.setType(group.type());
            dto.setOptions(options);
            groups.add(dto);
        }
        FacetsResponse response = new FacetsResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setGroups(groups);
        response.setTotalResults(outcome.totalResults());
        response.setPartial(!outcome.unavailableEntities().isEmpty());
        response.setUnavailableEntities(outcome.unavailableEntities().stream().map(EntityKind::value).toList());
        return response;
    }

    private static SearchHit toHit(ScoredResult result, String queryText) {
        Candidate candidate = result.candidate();
        ScoreBreakdown scores = result.scores();

        SearchHit.ScoreBreakdown breakdown = new SearchHit.ScoreBreakdown();
        breakdown.setTextualRelevance(scores.textual());
        breakdown.setRecencyScore(scores.recency());
        breakdown.setPopularityScore(scores.popularity());
        breakdown.setQualityScore(scores.quality());
        breakdown.setFinalScore(scores.composite());

        SearchHit hit = new SearchHit();
        hit.setId(candidate.id());
        hit.setEntityType(candidate.kind().value());
        hit.setTitle(candidate.title());
        hit.setDescription(candidate.description());
        hit.setRelevanceScore(scores.composite());
        hit.setScoreBreakdown(breakdown);
        hit.setHighlights(HighlightGenerator.highlights(candidate, queryText));
        hit.setMetadata(candidate.metadata());
        hit.setCreatedAt(candidate.createdAt());
        hit.setUpdatedAt(candidate.updatedAt());
        return hit;
    }
}
