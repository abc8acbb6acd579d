package com.iplicense.search.common;

/**
 * Caller identity as resolved by the upstream gateway. Entity adapters turn it into visibility predicates.
 */
public record PermissionContext(
    String userId,
    String sessionId,
    CallerRole role,
    String creatorId,
    String brandId
) {
    public static final PermissionContext ANONYMOUS = new PermissionContext(null, null, CallerRole.ANONYMOUS, null, null);

    public PermissionContext {
        if (role == null) {
            role = CallerRole.ANONYMOUS;
        }
    }

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }

    public boolean isCreator() {
        return role == CallerRole.CREATOR && creatorId != null;
    }

    public boolean isBrand() {
        return role == CallerRole.BRAND && brandId != null;
    }
}
