package com.eventpod.crawler.infra.retry;

public record RetryPolicy(int maxAttempts, BackoffPolicy backoff, ErrorClassifier classifier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }
}
