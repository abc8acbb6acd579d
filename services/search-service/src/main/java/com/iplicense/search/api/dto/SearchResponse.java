package com.iplicense.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.iplicense.search.suggest.DidYouMean;
import java.util.List;
import java.util.Map;

public class SearchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    private List<SearchHit> results;
    private Pagination pagination;
    private Facets facets;
    private String query;
    private long executionTimeMs;
    private String eventId;
    private boolean partial;
    private List<String> unavailableEntities;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private DidYouMean didYouMean;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public List<SearchHit> getResults() {
        return results;
    }

    public void setResults(List<SearchHit> results) {
        this.results = results;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Facets getFacets() {
        return facets;
    }

    public void setFacets(Facets facets) {
        this.facets = facets;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }

    public List<String> getUnavailableEntities() {
        return unavailableEntities;
    }

    public void setUnavailableEntities(List<String> unavailableEntities) {
        this.unavailableEntities = unavailableEntities;
    }

    public DidYouMean getDidYouMean() {
        return didYouMean;
    }

    public void setDidYouMean(DidYouMean didYouMean) {
        this.didYouMean = didYouMean;
    }

    public static class Pagination {
        private int page;
        private int pageSize;
        private long total;
        private int totalPages;
        private boolean hasNextPage;
        private boolean hasPreviousPage;

        public int getPage() {
            return page;
        }

        public void setPage(int page) {
            this.page = page;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public long getTotal() {
            return total;
        }

        public void setTotal(long total) {
            this.total = total;
        }

        public int getTotalPages() {
            return totalPages;
        }

        public void setTotalPages(int totalPages) {
            this.totalPages = totalPages;
        }

        @JsonProperty("hasNextPage")
        public boolean isHasNextPage() {
            return hasNextPage;
        }

        public void setHasNextPage(boolean hasNextPage) {
            this.hasNextPage = hasNextPage;
        }

        @JsonProperty("hasPreviousPage")
        public boolean isHasPreviousPage() {
            return hasPreviousPage;
        }

        public void setHasPreviousPage(boolean hasPreviousPage) {
            this.hasPreviousPage = hasPreviousPage;
        }
    }

    public static class Facets {
        private Map<String, Long> entityCounts;

        public Map<String, Long> getEntityCounts() {
            return entityCounts;
        }

        public void setEntityCounts(Map<String, Long> entityCounts) {
            this.entityCounts = entityCounts;
        }
    }
}
