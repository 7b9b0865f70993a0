package com.eventpod.crawler.infra.exchange.scheduler;

import com.eventpod.crawler.infra.crawler.AbstractPollingFeed;
import com.eventpod.crawler.infra.exchange.client.BinanceRestClient;
import com.eventpod.crawler.infra.exchange.client.PriceTickHandler;
import com.eventpod.crawler.infra.exchange.config.ExchangeFeedProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;

@Slf4j
public class BinanceRestPoller extends AbstractPollingFeed {

    private final BinanceRestClient restClient;
    private final ExchangeFeedProperties properties;
    private final PriceTickHandler tickHandler;

    public BinanceRestPoller(BinanceRestClient restClient,
                             ExchangeFeedProperties properties,
                             PriceTickHandler tickHandler,
                             TaskScheduler taskScheduler) {
        super(taskScheduler);
        this.restClient = restClient;
        this.properties = properties;
        this.tickHandler = tickHandler;
    }

    @Override
    public String name() {
        return "BINANCE_REST";
    }

    @Override
    protected Duration pollInterval() {
        return Duration.ofMillis(properties.getRestPollIntervalMs());
    }

    @Override
    protected void pollOnce() {
        syncPrices();
    }

    public int syncPrices() {
        log.info("[Binance REST] 가격 동기화 시작: symbols={}", properties.getSymbols());
        int processed = 0;
        for (String symbol : properties.getSymbols()) {
            var tick = restClient.getTickerPrice(symbol);
            if (tick.isEmpty()) {
                continue;
            }
            try {
                tickHandler.onTick(tick.get());
                processed++;
            } catch (RuntimeException e) {
                log.error("[Binance REST] 가격 반영 실패: symbol={}", symbol, e);
            }
        }
        log.info("[Binance REST] 가격 동기화 완료: processed={}, total={}", processed, properties.getSymbols().size());
        return processed;
    }
}
