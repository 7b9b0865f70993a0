package com.eventpod.crawler.infra.sports.client;

import com.eventpod.crawler.infra.http.JsonHttpClient;
import com.eventpod.crawler.infra.retry.RetryPolicy;
import com.eventpod.crawler.infra.sports.config.NbaFeedProperties;
import com.eventpod.crawler.infra.sports.dto.NbaScheduleResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class SportradarNbaClient {

    private final JsonHttpClient httpClient;
    private final NbaFeedProperties properties;
    private final RetryPolicy retryPolicy;

    public NbaScheduleResponse fetchDailySchedule(LocalDate date) {
        String url = String.format("%s/%s/games/%d/%02d/%02d/schedule.json",
                properties.resolveBaseUrl(), properties.getLanguageCode(),
                date.getYear(), date.getMonthValue(), date.getDayOfMonth());

        NbaScheduleResponse response = httpClient.get(url,
                Map.of("x-api-key", properties.getApiKey() == null ? "" : properties.getApiKey()),
                NbaScheduleResponse.class, retryPolicy);
        log.info("[NBA] 일정 수신: date={}, games={}", date, response.getGames().size());
        return response;
    }
}
