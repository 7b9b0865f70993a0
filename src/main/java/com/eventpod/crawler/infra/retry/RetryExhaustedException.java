package com.eventpod.crawler.infra.retry;

import lombok.Getter;

@Getter
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;
    private final ErrorClass lastErrorClass;

    public RetryExhaustedException(int attempts, ErrorClass lastErrorClass, Throwable lastError) {
        super(String.format("gave up after %d attempt(s) (%s): %s",
                attempts, lastErrorClass, lastError.getMessage()), lastError);
        this.attempts = attempts;
        this.lastErrorClass = lastErrorClass;
    }

    public boolean isTerminal() {
        return lastErrorClass == ErrorClass.TERMINAL;
    }
}
