package com.eventpod.crawler.infra.exchange.config;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.domain.service.CryptoTickProcessor;
import com.eventpod.crawler.infra.crawler.FeedRegistration;
import com.eventpod.crawler.infra.exchange.client.BinanceRestClient;
import com.eventpod.crawler.infra.exchange.client.BinanceStreamClient;
import com.eventpod.crawler.infra.exchange.client.BybitStreamClient;
import com.eventpod.crawler.infra.exchange.client.OkxStreamClient;
import com.eventpod.crawler.infra.exchange.client.PriceTickHandler;
import com.eventpod.crawler.infra.exchange.scheduler.BinanceRestPoller;
import com.eventpod.crawler.infra.http.HttpErrorClassifier;
import com.eventpod.crawler.infra.http.JsonHttpClient;
import com.eventpod.crawler.infra.retry.ExponentialBackoff;
import com.eventpod.crawler.infra.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;

@Configuration
public class ExchangeFeedConfig {

    static final RetryPolicy BINANCE_REST_RETRY = new RetryPolicy(3,
            new ExponentialBackoff(Duration.ofSeconds(3), Duration.ofSeconds(30), Duration.ofSeconds(2)),
            HttpErrorClassifier.INSTANCE);

    @Bean
    @ConfigurationProperties(prefix = "crawler.binance")
    public ExchangeFeedProperties binanceFeedProperties() {
        ExchangeFeedProperties properties = new ExchangeFeedProperties();
        properties.setWsUrl("wss://stream.binance.com:9443/stream");
        properties.setRestUrl("https://api.binance.com/api/v3");
        properties.setRestFallbackEnabled(true);
        return properties;
    }

    @Bean
    @ConfigurationProperties(prefix = "crawler.bybit")
    public ExchangeFeedProperties bybitFeedProperties() {
        ExchangeFeedProperties properties = new ExchangeFeedProperties();
        properties.setWsUrl("wss://stream.bybit.com/v5/public/spot");
        return properties;
    }

    @Bean
    @ConfigurationProperties(prefix = "crawler.okx")
    public ExchangeFeedProperties okxFeedProperties() {
        ExchangeFeedProperties properties = new ExchangeFeedProperties();
        properties.setWsUrl("wss://ws.okx.com:8443/ws/v5/public");
        return properties;
    }

    @Bean
    public BinanceStreamClient binanceStreamClient(OkHttpClient okHttpClient,
                                                   ObjectMapper objectMapper,
                                                   CryptoTickProcessor tickProcessor,
                                                   MeterRegistry meterRegistry) {
        ExchangeFeedProperties properties = binanceFeedProperties();
        return new BinanceStreamClient(okHttpClient, properties, objectMapper,
                tickHandler(Exchange.BINANCE, properties, tickProcessor), meterRegistry);
    }

    @Bean
    public BinanceRestClient binanceRestClient(JsonHttpClient jsonHttpClient) {
        return new BinanceRestClient(jsonHttpClient, binanceFeedProperties().getRestUrl(), BINANCE_REST_RETRY);
    }

    @Bean
    public BinanceRestPoller binanceRestPoller(BinanceRestClient binanceRestClient,
                                               CryptoTickProcessor tickProcessor,
                                               TaskScheduler taskScheduler) {
        ExchangeFeedProperties properties = binanceFeedProperties();
        return new BinanceRestPoller(binanceRestClient, properties,
                tickHandler(Exchange.BINANCE, properties, tickProcessor), taskScheduler);
    }

    @Bean
    public BybitStreamClient bybitStreamClient(OkHttpClient okHttpClient,
                                               ObjectMapper objectMapper,
                                               CryptoTickProcessor tickProcessor,
                                               MeterRegistry meterRegistry) {
        ExchangeFeedProperties properties = bybitFeedProperties();
        return new BybitStreamClient(okHttpClient, properties, objectMapper,
                tickHandler(Exchange.BYBIT, properties, tickProcessor), meterRegistry);
    }

    @Bean
    public OkxStreamClient okxStreamClient(OkHttpClient okHttpClient,
                                           ObjectMapper objectMapper,
                                           CryptoTickProcessor tickProcessor,
                                           MeterRegistry meterRegistry) {
        ExchangeFeedProperties properties = okxFeedProperties();
        return new OkxStreamClient(okHttpClient, properties, objectMapper,
                tickHandler(Exchange.OKX, properties, tickProcessor), meterRegistry);
    }

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "crawler.binance", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FeedRegistration binanceFeed(BinanceStreamClient binanceStreamClient, BinanceRestPoller binanceRestPoller) {
        return new FeedRegistration(binanceStreamClient,
                binanceFeedProperties().isRestFallbackEnabled() ? binanceRestPoller : null);
    }

    @Bean
    @Order(2)
    @ConditionalOnProperty(prefix = "crawler.bybit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FeedRegistration bybitFeed(BybitStreamClient bybitStreamClient) {
        return FeedRegistration.of(bybitStreamClient);
    }

    @Bean
    @Order(3)
    @ConditionalOnProperty(prefix = "crawler.okx", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FeedRegistration okxFeed(OkxStreamClient okxStreamClient) {
        return FeedRegistration.of(okxStreamClient);
    }

    private static PriceTickHandler tickHandler(Exchange exchange,
                                                ExchangeFeedProperties properties,
                                                CryptoTickProcessor tickProcessor) {
        return tick -> tickProcessor.process(exchange, properties.identity(), tick);
    }
}
