package com.iplicense.search.service;

import com.iplicense.search.query.SearchFilters;
import java.util.List;

/** Raw inbound search parameters, before normalization. */
public record SearchCommand(
    String query,
    List<String> entities,
    SearchFilters filters,
    Integer page,
    Integer pageSize,
    String sortBy,
    String sortOrder
) {
}
