package com.eventpod.crawler.domain.model;

public enum GameStatus {

    SCHEDULED("scheduled", LiveStatus.SCHEDULED, "Q1"),
    IN_PROGRESS("inprogress", LiveStatus.LIVE, "Q1"),
    CLOSED("closed", LiveStatus.FINISHED, "FT");

    private final String providerValue;
    private final LiveStatus liveStatus;
    private final String stage;

    GameStatus(String providerValue, LiveStatus liveStatus, String stage) {
        this.providerValue = providerValue;
        this.liveStatus = liveStatus;
        this.stage = stage;
    }

    public LiveStatus liveStatus() {
        return liveStatus;
    }

    public String stage() {
        return stage;
    }

    public static GameStatus fromProvider(String status) {
        for (GameStatus candidate : values()) {
            if (candidate.providerValue.equals(status)) {
                return candidate;
            }
        }
        return SCHEDULED;
    }
}
