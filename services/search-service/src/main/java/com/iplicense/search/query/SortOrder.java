package com.iplicense.search.query;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder from(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new InvalidSearchRequestException("sortOrder must be asc or desc");
        };
    }
}
