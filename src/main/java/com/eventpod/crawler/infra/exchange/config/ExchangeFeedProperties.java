package com.eventpod.crawler.infra.exchange.config;

import com.eventpod.crawler.domain.model.FeedIdentity;
import com.eventpod.crawler.infra.exchange.client.ReconnectBackoff;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class ExchangeFeedProperties {

    private boolean enabled = true;

    private String wsUrl;

    private String restUrl;

    private List<String> symbols = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT"));

    private String categoryGuid;

    private String ecosystemGuid;

    private String languageGuid;

    private long reconnectInitialDelayMs = 5_000;

    private long reconnectMaxDelayMs = 60_000;

    private double reconnectMultiplier = 1.5;

    private long heartbeatIntervalMs = 20_000;

    private boolean restFallbackEnabled = false;

    private long restPollIntervalMs = 30_000;

    public FeedIdentity identity() {
        return new FeedIdentity(categoryGuid, ecosystemGuid, languageGuid);
    }

    public ReconnectBackoff newReconnectBackoff() {
        return new ReconnectBackoff(
                Duration.ofMillis(reconnectInitialDelayMs),
                Duration.ofMillis(reconnectMaxDelayMs),
                reconnectMultiplier);
    }
}
