package com.iplicense.search.common;

public final class RequestContextHolder {
    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static RequestContext get() {
        return CONTEXT.get();
    }

    public static PermissionContext permissions() {
        RequestContext context = CONTEXT.get();
        return context == null ? PermissionContext.ANONYMOUS : context.getPermissions();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
