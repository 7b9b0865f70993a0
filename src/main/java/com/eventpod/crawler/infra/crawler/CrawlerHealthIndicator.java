package com.eventpod.crawler.infra.crawler;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CrawlerHealthIndicator implements HealthIndicator {

    private final CrawlerSupervisor supervisor;

    @Override
    public Health health() {
        boolean anyRunning = false;
        Map<String, Object> details = new LinkedHashMap<>();

        for (FeedRegistration registration : supervisor.registrations()) {
            FeedAdapter active = registration.primary();
            if (!active.isRunning() && registration.fallback() != null && registration.fallback().isRunning()) {
                active = registration.fallback();
            }
            anyRunning |= active.isRunning();
            details.put(registration.primary().name(), Map.of(
                    "adapter", active.name(),
                    "running", active.isRunning(),
                    "connected", active.isConnected()
            ));
        }

        Health.Builder builder = anyRunning || details.isEmpty() ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }
}
