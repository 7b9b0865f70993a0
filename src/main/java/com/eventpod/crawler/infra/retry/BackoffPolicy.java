package com.eventpod.crawler.infra.retry;

import java.time.Duration;

@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attempt zero-based index of the attempt that just failed
     */
    Duration delayFor(int attempt);
}
