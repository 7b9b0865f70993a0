package com.eventpod.crawler.infra.retry;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

public class ExponentialBackoff implements BackoffPolicy {

    private final Duration min;
    private final Duration max;
    private final Duration maxJitter;
    private final LongUnaryOperator jitterSource;

    public ExponentialBackoff(Duration min, Duration max, Duration maxJitter) {
        this(min, max, maxJitter, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    public ExponentialBackoff(Duration min, Duration max, Duration maxJitter, Random random) {
        this(min, max, maxJitter, bound -> random.nextLong(bound));
    }

    private ExponentialBackoff(Duration min, Duration max, Duration maxJitter, LongUnaryOperator jitterSource) {
        if (min.isNegative() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("backoff requires 0 <= min <= max");
        }
        this.min = min;
        this.max = max;
        this.maxJitter = maxJitter;
        this.jitterSource = jitterSource;
    }

    @Override
    public Duration delayFor(int attempt) {
        long capMs = max.toMillis();
        long delay = min.toMillis();
        for (int i = 0; i < attempt && delay < capMs; i++) {
            delay *= 2;
        }
        long jitterMs = maxJitter.toMillis() > 0 ? jitterSource.applyAsLong(maxJitter.toMillis()) : 0L;
        return Duration.ofMillis(Math.min(delay + jitterMs, capMs));
    }
}
