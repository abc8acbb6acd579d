package com.iplicense.search.adapter;

import com.iplicense.search.scoring.Candidate;
import java.util.List;

public record AdapterResult(List<Candidate> candidates, long totalCount) {
    public AdapterResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        totalCount = Math.max(totalCount, candidates.size());
    }

    public static AdapterResult empty() {
        return new AdapterResult(List.of(), 0L);
    }
}
