package com.eventpod.crawler.infra.retry;

public enum ErrorClass {
    RETRYABLE,
    TERMINAL
}
