package com.iplicense.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class AckResponse {
    private String status;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public AckResponse() {
    }

    public AckResponse(String status, String traceId, String requestId) {
        this.status = status;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

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
}
