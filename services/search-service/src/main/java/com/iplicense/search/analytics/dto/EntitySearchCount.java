package com.iplicense.search.analytics.dto;

public record EntitySearchCount(String entity, long searchCount) {
}
