package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.FeedIdentity;
import com.eventpod.crawler.domain.model.GameStatus;
import com.eventpod.crawler.domain.model.GameUpdate;
import com.eventpod.crawler.domain.model.TeamRef;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class NbaEventCommandFactory {

    private static final DateTimeFormatter SCHEDULED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public EventUpsertCommand create(FeedIdentity identity, GameUpdate game) {
        GameStatus status = GameStatus.fromProvider(game.status());
        boolean closed = status == GameStatus.CLOSED;
        String gameTime = normalizeScheduledTime(game.scheduledTime());

        Map<String, Object> info = new LinkedHashMap<>(game.rawPayload());
        info.put("external_id", game.externalGameId());
        info.put("status", game.status());
        info.put("open_time", gameTime);

        return EventUpsertCommand.builder()
                .externalId(game.externalGameId())
                .categoryGuid(identity.categoryGuid())
                .ecosystemGuid(identity.ecosystemGuid())
                .languageGuid(identity.languageGuid())
                .periodCode(game.externalGameId())
                .periodScheduled(gameTime)
                .periodRemark("NBA game date: " + gameTime)
                .homeTeam(game.homeTeam())
                .awayTeam(game.awayTeam())
                .mainScore(game.homeScore() == null ? "0" : String.valueOf(game.homeScore()))
                .clusterScore(game.awayScore() == null ? "0" : String.valueOf(game.awayScore()))
                .liveStatus(status.liveStatus())
                .stage(status.stage())
                .info(info)
                .title(teamName(game.homeTeam()) + " vs " + teamName(game.awayTeam()))
                .rules(String.format("NBA %s season game. Home: %s, Away: %s.",
                        game.seasonType(), teamName(game.homeTeam()), teamName(game.awayTeam())))
                .sports(true)
                .onlineOnCreate(closed)
                .onlineOverride(closed ? Boolean.TRUE : null)
                .build();
    }

    static String normalizeScheduledTime(String scheduled) {
        if (scheduled == null || scheduled.isBlank()) {
            return "";
        }
        try {
            return OffsetDateTime.parse(scheduled, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .format(SCHEDULED);
        } catch (DateTimeParseException e) {
            return scheduled;
        }
    }

    private static String teamName(TeamRef team) {
        return team == null || team.name() == null ? "" : team.name();
    }
}
