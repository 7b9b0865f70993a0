package com.eventpod.crawler.infra.crawler;

@FunctionalInterface
public interface CriticalErrorHandler {

    void onCriticalError(Throwable cause);
}
