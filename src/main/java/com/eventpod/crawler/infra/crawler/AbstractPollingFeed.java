package com.eventpod.crawler.infra.crawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public abstract class AbstractPollingFeed implements FeedAdapter {

    private final TaskScheduler taskScheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean lastPollSucceeded = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledPoll;

    protected AbstractPollingFeed(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    protected abstract Duration pollInterval();

    protected abstract void pollOnce();

    @Override
    public synchronized void start() {
        if (running.get()) {
            throw new FeedStartException(name() + " poller is already running");
        }
        Duration interval = pollInterval();
        running.set(true);
        try {
            scheduledPoll = taskScheduler.scheduleWithFixedDelay(this::safePoll, Instant.now(), interval);
        } catch (TaskRejectedException e) {
            running.set(false);
            throw new FeedStartException(name() + " poller could not be scheduled", e);
        }
        log.info("[Crawler] {} 폴링 시작 (interval={}ms)", name(), interval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        scheduledPoll.cancel(true);
        scheduledPoll = null;
        log.info("[Crawler] {} 폴링 중지", name());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isConnected() {
        return running.get() && lastPollSucceeded.get();
    }

    private void safePoll() {
        if (!running.get()) {
            return;
        }
        try {
            pollOnce();
            lastPollSucceeded.set(true);
        } catch (RuntimeException e) {
            lastPollSucceeded.set(false);
            log.error("[Crawler] {} 폴링 실패", name(), e);
        }
    }
}
