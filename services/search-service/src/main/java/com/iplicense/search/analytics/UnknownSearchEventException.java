package com.iplicense.search.analytics;

public class UnknownSearchEventException extends RuntimeException {
    private final String eventId;

    public UnknownSearchEventException(String eventId) {
        super("search event not found: " + eventId);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
