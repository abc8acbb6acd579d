package com.iplicense.search.scoring;

public record PopularityVector(long views, long usage, long favorites) {
    public static final PopularityVector NONE = new PopularityVector(0L, 0L, 0L);

    public PopularityVector {
        views = Math.max(0L, views);
        usage = Math.max(0L, usage);
        favorites = Math.max(0L, favorites);
    }
}
