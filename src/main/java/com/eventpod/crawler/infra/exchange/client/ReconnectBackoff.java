package com.eventpod.crawler.infra.exchange.client;

import java.time.Duration;

public class ReconnectBackoff {

    private final long initialMs;
    private final long maxMs;
    private final double multiplier;

    private long currentMs;

    public ReconnectBackoff(Duration initial, Duration max, double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.initialMs = initial.toMillis();
        this.maxMs = Math.max(max.toMillis(), initialMs);
        this.multiplier = multiplier;
        this.currentMs = initialMs;
    }

    public synchronized Duration nextDelay() {
        long delay = currentMs;
        currentMs = Math.min((long) (currentMs * multiplier), maxMs);
        return Duration.ofMillis(delay);
    }

    public synchronized Duration peek() {
        return Duration.ofMillis(currentMs);
    }

    public synchronized void reset() {
        currentMs = initialMs;
    }
}
