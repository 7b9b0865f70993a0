package com.eventpod.crawler.infra.retry;

@FunctionalInterface
public interface ErrorClassifier {

    ErrorClassifier ALWAYS_RETRY = e -> ErrorClass.RETRYABLE;

    ErrorClass classify(Exception e);
}
