package com.iplicense.search.api.dto;

public class ClickRequest {
    private String eventId;
    private String resultId;
    private Integer resultPosition;
    private String resultEntityKind;

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getResultId() {
        return resultId;
    }

    public void setResultId(String resultId) {
        this.resultId = resultId;
    }

    public Integer getResultPosition() {
        return resultPosition;
    }

    public void setResultPosition(Integer resultPosition) {
        this.resultPosition = resultPosition;
    }

    public String getResultEntityKind() {
        return resultEntityKind;
    }

    public void setResultEntityKind(String resultEntityKind) {
        this.resultEntityKind = resultEntityKind;
    }
}
