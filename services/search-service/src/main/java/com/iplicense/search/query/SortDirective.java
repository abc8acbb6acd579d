package com.iplicense.search.query;

public record SortDirective(SortField field, SortOrder order) {
    public static final SortDirective RELEVANCE = new SortDirective(SortField.RELEVANCE, SortOrder.DESC);

    public SortDirective {
        if (field == null) {
            field = SortField.RELEVANCE;
        }
        if (order == null) {
            order = field.defaultOrder();
        }
    }

    public boolean isRelevance() {
        return field == SortField.RELEVANCE;
    }
}
