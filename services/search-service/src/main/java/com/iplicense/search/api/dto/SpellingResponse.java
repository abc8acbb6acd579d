package com.iplicense.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.iplicense.search.suggest.SpellingSuggestion;
import java.util.List;

public class SpellingResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    private boolean hasAlternative;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private SpellingSuggestion suggestion;

    private List<SpellingSuggestion> alternatives;

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

    @JsonProperty("hasAlternative")
    public boolean isHasAlternative() {
        return hasAlternative;
    }

    public void setHasAlternative(boolean hasAlternative) {
        this.hasAlternative = hasAlternative;
    }

    public SpellingSuggestion getSuggestion() {
        return suggestion;
    }

    public void setSuggestion(SpellingSuggestion suggestion) {
        this.suggestion = suggestion;
    }

    public List<SpellingSuggestion> getAlternatives() {
        return alternatives;
    }

    public void setAlternatives(List<SpellingSuggestion> alternatives) {
        this.alternatives = alternatives;
    }
}
