package com.eventpod.crawler.infra.crawler;

import org.springframework.lang.Nullable;

public record FeedRegistration(FeedAdapter primary, @Nullable FeedAdapter fallback) {

    public static FeedRegistration of(FeedAdapter primary) {
        return new FeedRegistration(primary, null);
    }
}
