package com.eventpod.crawler.infra.crawler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationShutdownHandler implements CriticalErrorHandler {

    private final ConfigurableApplicationContext applicationContext;

    @Override
    public void onCriticalError(Throwable cause) {
        log.error("[Crawler] 애플리케이션 컨텍스트 종료: {}", cause.getMessage());
        applicationContext.close();
    }
}
