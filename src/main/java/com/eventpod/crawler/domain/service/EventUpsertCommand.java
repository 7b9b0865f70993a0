package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.LiveStatus;
import com.eventpod.crawler.domain.model.TeamRef;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * {@link #onlineOverride} is null when an update must leave the visibility flag untouched.
 */
@Getter
@Builder
@ToString
public class EventUpsertCommand {

    private final String externalId;
    private final String categoryGuid;
    private final String ecosystemGuid;
    private final String languageGuid;

    private final String periodCode;
    private final String periodScheduled;
    private final String periodRemark;

    private final TeamRef homeTeam;
    private final TeamRef awayTeam;

    private final String mainScore;
    private final String clusterScore;
    private final String price;

    private final LiveStatus liveStatus;
    private final String stage;
    private final Map<String, Object> info;

    private final String title;
    private final String rules;

    private final boolean sports;
    private final boolean onlineOnCreate;
    private final Boolean onlineOverride;
}
