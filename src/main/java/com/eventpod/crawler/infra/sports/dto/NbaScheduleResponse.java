package com.eventpod.crawler.infra.sports.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class NbaScheduleResponse {

    private String date;

    private List<NbaGame> games = new ArrayList<>();

    private NbaLeague league = new NbaLeague();

    @Getter
    @Setter
    @NoArgsConstructor
    @ToString
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NbaLeague {
        private String id;
        private String name;
        private String alias;
    }
}
