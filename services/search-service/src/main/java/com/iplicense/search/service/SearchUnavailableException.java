package com.iplicense.search.service;

import com.iplicense.search.query.EntityKind;
import java.util.List;

/** Every requested entity adapter failed or timed out. */
public class SearchUnavailableException extends RuntimeException {
    private final List<EntityKind> unavailable;

    public SearchUnavailableException(List<EntityKind> unavailable) {
        super("search is temporarily unavailable");
        this.unavailable = List.copyOf(unavailable);
    }

    public List<EntityKind> getUnavailable() {
        return unavailable;
    }
}
