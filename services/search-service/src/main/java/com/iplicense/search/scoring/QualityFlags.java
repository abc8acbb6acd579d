package com.iplicense.search.scoring;

public record QualityFlags(boolean verified, boolean active, boolean approved) {
    public static final QualityFlags NONE = new QualityFlags(false, false, false);
}
