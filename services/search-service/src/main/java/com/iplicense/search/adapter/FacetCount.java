package com.iplicense.search.adapter;

public record FacetCount(String value, long count) {}
