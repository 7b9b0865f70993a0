package com.eventpod.crawler.domain.model;

import java.util.Map;

public record GameUpdate(
        String externalGameId,
        String status,
        String scheduledTime,
        TeamRef homeTeam,
        TeamRef awayTeam,
        Integer homeScore,
        Integer awayScore,
        String seasonType,
        Map<String, Object> rawPayload
) {

    public GameUpdate {
        if (externalGameId == null || externalGameId.isBlank()) {
            throw new IllegalArgumentException("externalGameId must not be blank");
        }
        rawPayload = rawPayload == null ? Map.of() : rawPayload;
    }
}
