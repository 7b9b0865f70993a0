package com.eventpod.crawler.infra.retry;

import java.time.Duration;
import java.util.concurrent.Callable;

public final class RetryExecutor {

    private RetryExecutor() {
    }

    public static <T> T execute(RetryPolicy policy, Callable<T> call) {
        Exception lastError = null;
        ErrorClass lastClass = ErrorClass.RETRYABLE;
        int attempt = 0;

        while (attempt < policy.maxAttempts()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RetryExhaustedException(attempt, lastClass,
                        lastError != null ? lastError : new InterruptedException("retry cancelled"));
            }
            try {
                return call.call();
            } catch (Exception e) {
                lastError = e;
                lastClass = policy.classifier().classify(e);
                attempt++;
                if (lastClass == ErrorClass.TERMINAL || attempt >= policy.maxAttempts()) {
                    break;
                }
                sleep(policy.backoff().delayFor(attempt - 1), attempt, lastClass, e);
            }
        }
        throw new RetryExhaustedException(attempt, lastClass, lastError);
    }

    private static void sleep(Duration delay, int attempt, ErrorClass errorClass, Exception lastError) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            lastError.addSuppressed(ie);
            throw new RetryExhaustedException(attempt, errorClass, lastError);
        }
    }
}
