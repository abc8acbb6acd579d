package com.iplicense.search.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EntityKind {
    ASSETS("assets"),
    CREATORS("creators"),
    PROJECTS("projects"),
    LICENSES("licenses");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves the wire name of an entity kind. Returns {@code null} for unknown names so callers can
     * report every offending value at once.
     */
    @JsonCreator
    public static EntityKind from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
