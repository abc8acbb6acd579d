package com.iplicense.search.service;

import com.iplicense.search.query.EntityKind;

/**
 * Result of one adapter call within a fan-out: either the adapter's value or the reason it is missing.
 */
public class AdapterOutcome<T> {
    private final EntityKind kind;
    private final T result;
    private final boolean error;
    private final boolean timedOut;
    private final long tookMs;
    private final String errorMessage;

    private AdapterOutcome(EntityKind kind, T result, boolean error, boolean timedOut, long tookMs, String errorMessage) {
        this.kind = kind;
        this.result = result;
        this.error = error;
        this.timedOut = timedOut;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static <T> AdapterOutcome<T> success(EntityKind kind, T result, long tookMs) {
        return new AdapterOutcome<>(kind, result, false, false, tookMs, null);
    }

    public static <T> AdapterOutcome<T> error(EntityKind kind, String message) {
        return new AdapterOutcome<>(kind, null, true, false, 0L, message);
    }

    public static <T> AdapterOutcome<T> timedOut(EntityKind kind) {
        return new AdapterOutcome<>(kind, null, true, true, 0L, "timeout");
    }

    public EntityKind getKind() {
        return kind;
    }

    public T getResult() {
        return result;
    }

    public boolean isError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
