package com.iplicense.search.query;

import java.util.Locale;

public enum SortField {
    RELEVANCE("relevance", SortOrder.DESC),
    CREATED_AT("created_at", SortOrder.DESC),
    UPDATED_AT("updated_at", SortOrder.DESC),
    TITLE("title", SortOrder.ASC),
    VERIFIED_AT("verified_at", SortOrder.DESC),
    TOTAL_COLLABORATIONS("total_collaborations", SortOrder.DESC),
    TOTAL_REVENUE("total_revenue", SortOrder.DESC),
    AVERAGE_RATING("average_rating", SortOrder.DESC);

    private final String value;
    private final SortOrder defaultOrder;

    SortField(String value, SortOrder defaultOrder) {
        this.value = value;
        this.defaultOrder = defaultOrder;
    }

    public String value() {
        return value;
    }

    public SortOrder defaultOrder() {
        return defaultOrder;
    }

    public static SortField from(String raw) {
        if (raw == null || raw.isBlank()) {
            return RELEVANCE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("name".equals(normalized)) {
            return TITLE;
        }
        for (SortField field : values()) {
            if (field.value.equals(normalized)) {
                return field;
            }
        }
        throw new InvalidSearchRequestException("unsupported sortBy: " + raw.trim());
    }
}
