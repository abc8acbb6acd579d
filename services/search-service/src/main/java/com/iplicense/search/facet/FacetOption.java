package com.iplicense.search.facet;

public record FacetOption(String value, String label, long count, boolean selected) {}
