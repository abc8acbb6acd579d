package com.iplicense.search.common;

public class RequestContext {
    private final String requestId;
    private final String traceId;
    private final PermissionContext permissions;
    private final long startedAtNs;

    public RequestContext(String requestId, String traceId, PermissionContext permissions, long startedAtNs) {
        this.requestId = requestId;
        this.traceId = traceId;
        this.permissions = permissions == null ? PermissionContext.ANONYMOUS : permissions;
        this.startedAtNs = startedAtNs;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getTraceId() {
        return traceId;
    }

    public PermissionContext getPermissions() {
        return permissions;
    }

    public long getStartedAtNs() {
        return startedAtNs;
    }
}
