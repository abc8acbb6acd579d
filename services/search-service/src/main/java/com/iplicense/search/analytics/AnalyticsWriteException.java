package com.iplicense.search.analytics;

public class AnalyticsWriteException extends RuntimeException {
    public AnalyticsWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
