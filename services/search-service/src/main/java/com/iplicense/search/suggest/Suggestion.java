package com.iplicense.search.suggest;

import com.iplicense.search.query.EntityKind;

public record Suggestion(String id, String title, EntityKind kind, String subtitle, String thumbnailUrl) {}
