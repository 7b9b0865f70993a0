package com.eventpod.crawler.infra.sports.config;

import com.eventpod.crawler.domain.service.EventUpsertService;
import com.eventpod.crawler.domain.service.NbaEventCommandFactory;
import com.eventpod.crawler.infra.crawler.FeedRegistration;
import com.eventpod.crawler.infra.http.HttpErrorClassifier;
import com.eventpod.crawler.infra.http.JsonHttpClient;
import com.eventpod.crawler.infra.retry.ExponentialBackoff;
import com.eventpod.crawler.infra.retry.RetryPolicy;
import com.eventpod.crawler.infra.sports.client.SportradarNbaClient;
import com.eventpod.crawler.infra.sports.scheduler.NbaScheduleSyncService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class NbaFeedConfig {

    static final RetryPolicy SPORTRADAR_RETRY = new RetryPolicy(3,
            new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofMillis(500)),
            HttpErrorClassifier.INSTANCE);

    @Bean
    public SportradarNbaClient sportradarNbaClient(JsonHttpClient jsonHttpClient, NbaFeedProperties properties) {
        return new SportradarNbaClient(jsonHttpClient, properties, SPORTRADAR_RETRY);
    }

    @Bean
    public NbaScheduleSyncService nbaScheduleSyncService(SportradarNbaClient client,
                                                         NbaFeedProperties properties,
                                                         NbaEventCommandFactory commandFactory,
                                                         EventUpsertService upsertService,
                                                         Clock clock,
                                                         TaskScheduler taskScheduler) {
        return new NbaScheduleSyncService(client, properties, commandFactory, upsertService, clock, taskScheduler);
    }

    @Bean
    @Order(10)
    @ConditionalOnProperty(prefix = "crawler.nba", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FeedRegistration nbaFeed(NbaScheduleSyncService nbaScheduleSyncService) {
        return FeedRegistration.of(nbaScheduleSyncService);
    }
}
