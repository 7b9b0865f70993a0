package com.eventpod.crawler.infra.sports.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class NbaGame {

    private String id;

    private String status;

    private String scheduled;

    @JsonProperty("home_points")
    private Integer homePoints;

    @JsonProperty("away_points")
    private Integer awayPoints;

    private String coverage;

    @JsonProperty("track_on_court")
    private boolean trackOnCourt;

    @JsonProperty("sr_id")
    private String srId;

    private String reference;

    @JsonProperty("time_zones")
    private TimeZones timeZones = new TimeZones();

    private Season season = new Season();

    private Team home = new Team();

    private Team away = new Team();

    @Getter
    @Setter
    @NoArgsConstructor
    @ToString
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Team {
        private String id;
        private String name;
        private String alias;
        @JsonProperty("sr_id")
        private String srId;
        private String reference;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @ToString
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Season {
        private String id;
        private int year;
        private String type;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @ToString
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeZones {
        private String venue;
        private String home;
        private String away;
    }
}
