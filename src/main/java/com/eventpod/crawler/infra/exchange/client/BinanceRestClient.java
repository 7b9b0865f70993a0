package com.eventpod.crawler.infra.exchange.client;

import com.eventpod.crawler.domain.model.PriceTick;
import com.eventpod.crawler.infra.exchange.dto.BinanceTickerPrice;
import com.eventpod.crawler.infra.http.JsonHttpClient;
import com.eventpod.crawler.infra.retry.RetryExhaustedException;
import com.eventpod.crawler.infra.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class BinanceRestClient {

    private final JsonHttpClient httpClient;
    private final String restBaseUrl;
    private final RetryPolicy retryPolicy;

    public Optional<PriceTick> getTickerPrice(String symbol) {
        String url = HttpUrl.get(restBaseUrl).newBuilder()
                .addPathSegments("ticker/price")
                .addQueryParameter("symbol", symbol)
                .build()
                .toString();

        try {
            BinanceTickerPrice ticker = httpClient.get(url, Map.of(), BinanceTickerPrice.class, retryPolicy);
            if (ticker.getPrice() == null || ticker.getPrice().isBlank()) {
                log.warn("[Binance REST] 응답에 가격 없음: symbol={}", symbol);
                return Optional.empty();
            }
            String resolvedSymbol = ticker.getSymbol() == null || ticker.getSymbol().isBlank()
                    ? symbol : ticker.getSymbol();
            log.debug("[Binance REST] 가격 수신: symbol={}, price={}", resolvedSymbol, ticker.getPrice());
            return Optional.of(new PriceTick(resolvedSymbol, ticker.getPrice()));
        } catch (RetryExhaustedException e) {
            if (e.isTerminal()) {
                log.warn("[Binance REST] 클라이언트 오류, 이번 주기 스킵: symbol={}, cause={}", symbol, e.getMessage());
            } else {
                log.error("[Binance REST] 재시도 소진: symbol={}, attempts={}", symbol, e.getAttempts(), e);
            }
            return Optional.empty();
        }
    }
}
