package com.eventpod.crawler.infra.crawler;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class CrawlerSupervisor {

    private final List<FeedRegistration> registrations;
    private final CriticalErrorHandler criticalErrorHandler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    @Autowired
    public CrawlerSupervisor(ObjectProvider<FeedRegistration> registrations,
                             CriticalErrorHandler criticalErrorHandler) {
        this(registrations.orderedStream().toList(), criticalErrorHandler);
    }

    CrawlerSupervisor(List<FeedRegistration> registrations, CriticalErrorHandler criticalErrorHandler) {
        this.registrations = List.copyOf(registrations);
        this.criticalErrorHandler = criticalErrorHandler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public void start() {
        if (shutdown.get() || !started.compareAndSet(false, true)) {
            return;
        }
        for (FeedRegistration registration : registrations) {
            startFeed(registration);
        }
        log.info("[Crawler] 크롤러 기동 완료: feeds={}", registrations.stream().map(r -> r.primary().name()).toList());
    }

    @PreDestroy
    public void stop() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        for (FeedRegistration registration : registrations) {
            stopQuietly(registration.primary());
            if (registration.fallback() != null) {
                stopQuietly(registration.fallback());
            }
        }
        log.info("[Crawler] 크롤러 종료 완료");
    }

    public void reportCritical(Throwable cause) {
        log.error("[Crawler] 치명적 오류 보고, 프로세스 종료", cause);
        stop();
        criticalErrorHandler.onCriticalError(cause);
    }

    public List<FeedRegistration> registrations() {
        return registrations;
    }

    private void startFeed(FeedRegistration registration) {
        FeedAdapter primary = registration.primary();
        try {
            primary.start();
            log.info("[Crawler] {} 피드 시작", primary.name());
        } catch (RuntimeException e) {
            FeedAdapter fallback = registration.fallback();
            if (fallback == null) {
                log.error("[Crawler] {} 피드 시작 실패, 이 피드는 건너뜀", primary.name(), e);
                return;
            }
            log.error("[Crawler] {} 피드 시작 실패, {} 로 전환", primary.name(), fallback.name(), e);
            try {
                fallback.start();
            } catch (RuntimeException fallbackError) {
                log.error("[Crawler] {} 대체 피드 시작 실패", fallback.name(), fallbackError);
            }
        }
    }

    private void stopQuietly(FeedAdapter adapter) {
        try {
            adapter.stop();
        } catch (RuntimeException e) {
            log.warn("[Crawler] {} 중지 중 예외", adapter.name(), e);
        }
    }
}
