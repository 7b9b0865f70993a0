package com.eventpod.crawler.infra.sports.scheduler;

import com.eventpod.crawler.domain.model.GameUpdate;
import com.eventpod.crawler.domain.service.EventUpsertService;
import com.eventpod.crawler.domain.service.NbaEventCommandFactory;
import com.eventpod.crawler.infra.crawler.AbstractPollingFeed;
import com.eventpod.crawler.infra.sports.client.NbaGameMapper;
import com.eventpod.crawler.infra.sports.client.SportradarNbaClient;
import com.eventpod.crawler.infra.sports.config.NbaFeedProperties;
import com.eventpod.crawler.infra.sports.dto.NbaGame;
import com.eventpod.crawler.infra.sports.dto.NbaScheduleResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

@Slf4j
public class NbaScheduleSyncService extends AbstractPollingFeed {

    private final SportradarNbaClient client;
    private final NbaFeedProperties properties;
    private final NbaEventCommandFactory commandFactory;
    private final EventUpsertService upsertService;
    private final Clock clock;

    public NbaScheduleSyncService(SportradarNbaClient client,
                                  NbaFeedProperties properties,
                                  NbaEventCommandFactory commandFactory,
                                  EventUpsertService upsertService,
                                  Clock clock,
                                  TaskScheduler taskScheduler) {
        super(taskScheduler);
        this.client = client;
        this.properties = properties;
        this.commandFactory = commandFactory;
        this.upsertService = upsertService;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "NBA";
    }

    @Override
    protected Duration pollInterval() {
        return Duration.ofMillis(properties.getPollIntervalMs());
    }

    @Override
    protected void pollOnce() {
        LocalDate today = LocalDate.now(clock);
        syncDateRange(today, today.plusDays(Math.max(properties.getLookaheadDays(), 0)));
    }

    public int syncToday() {
        return syncDailySchedule(LocalDate.now(clock));
    }

    public int syncDateRange(LocalDate start, LocalDate end) {
        int processed = 0;
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            try {
                processed += syncDailySchedule(date);
            } catch (RuntimeException e) {
                log.error("[NBA] 일정 동기화 실패: date={}", date, e);
            }
        }
        return processed;
    }

    public int syncDailySchedule(LocalDate date) {
        log.info("[NBA] 일정 동기화 시작: date={}", date);
        NbaScheduleResponse schedule = client.fetchDailySchedule(date);

        int processed = 0;
        for (NbaGame game : schedule.getGames()) {
            try {
                GameUpdate update = NbaGameMapper.toGameUpdate(game, schedule.getLeague());
                upsertService.upsert(commandFactory.create(properties.identity(), update));
                processed++;
            } catch (RuntimeException e) {
                log.error("[NBA] 경기 처리 실패, 스킵: gameId={}", game.getId(), e);
            }
        }
        log.info("[NBA] 일정 동기화 완료: date={}, processed={}, total={}",
                date, processed, schedule.getGames().size());
        return processed;
    }
}
