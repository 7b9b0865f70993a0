package com.eventpod.crawler.infra.crawler;

public interface FeedAdapter {

    String name();

    void start();

    void stop();

    boolean isRunning();

    boolean isConnected();
}
