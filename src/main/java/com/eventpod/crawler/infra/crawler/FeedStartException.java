package com.eventpod.crawler.infra.crawler;

public class FeedStartException extends RuntimeException {

    public FeedStartException(String message) {
        super(message);
    }

    public FeedStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
