package com.eventpod.crawler.domain.service;

public class EventUpsertException extends RuntimeException {

    public EventUpsertException(String message) {
        super(message);
    }

    public EventUpsertException(String message, Throwable cause) {
        super(message, cause);
    }
}
