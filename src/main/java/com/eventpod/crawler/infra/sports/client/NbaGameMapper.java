package com.eventpod.crawler.infra.sports.client;

import com.eventpod.crawler.domain.model.GameUpdate;
import com.eventpod.crawler.domain.model.TeamRef;
import com.eventpod.crawler.infra.sports.dto.NbaGame;
import com.eventpod.crawler.infra.sports.dto.NbaScheduleResponse;

import java.util.LinkedHashMap;
import java.util.Map;

public final class NbaGameMapper {

    private NbaGameMapper() {
    }

    public static GameUpdate toGameUpdate(NbaGame game, NbaScheduleResponse.NbaLeague league) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("game_id", game.getId());
        payload.put("sr_id", game.getSrId());
        payload.put("reference", game.getReference());
        payload.put("coverage", game.getCoverage());
        payload.put("track_on_court", game.isTrackOnCourt());
        payload.put("league_id", league == null ? null : league.getId());
        payload.put("league_name", league == null ? null : league.getName());
        payload.put("season_id", game.getSeason().getId());
        payload.put("season_year", game.getSeason().getYear());
        payload.put("season_type", game.getSeason().getType());
        payload.put("scheduled", game.getScheduled());

        Map<String, Object> timeZones = new LinkedHashMap<>();
        timeZones.put("venue", game.getTimeZones().getVenue());
        timeZones.put("home", game.getTimeZones().getHome());
        timeZones.put("away", game.getTimeZones().getAway());
        payload.put("time_zones", timeZones);

        return new GameUpdate(
                game.getId(),
                game.getStatus(),
                game.getScheduled(),
                toTeamRef(game.getHome()),
                toTeamRef(game.getAway()),
                game.getHomePoints(),
                game.getAwayPoints(),
                game.getSeason().getType(),
                payload);
    }

    private static TeamRef toTeamRef(NbaGame.Team team) {
        return new TeamRef(team.getId(), team.getName(), team.getAlias());
    }
}
