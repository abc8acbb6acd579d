package com.iplicense.search.suggest;

public record SpellingSuggestion(
    String originalQuery,
    String suggestedQuery,
    double confidence,
    long expectedResultCount,
    int distance
) {}
