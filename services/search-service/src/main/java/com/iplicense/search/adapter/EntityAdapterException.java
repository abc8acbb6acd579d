package com.iplicense.search.adapter;

import com.iplicense.search.query.EntityKind;

public class EntityAdapterException extends RuntimeException {
    private final EntityKind kind;

    public EntityAdapterException(EntityKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public EntityKind getKind() {
        return kind;
    }
}
