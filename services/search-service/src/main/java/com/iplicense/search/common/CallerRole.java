package com.iplicense.search.common;

import java.util.Locale;

public enum CallerRole {
    ADMIN,
    CREATOR,
    BRAND,
    VIEWER,
    ANONYMOUS;

    public static CallerRole from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANONYMOUS;
        }
        try {
            return CallerRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return VIEWER;
        }
    }
}
