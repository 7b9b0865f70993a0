package com.eventpod.crawler.infra.exchange.client;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.infra.exchange.config.ExchangeFeedProperties;
import com.eventpod.crawler.infra.exchange.decoder.BinanceTickerDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.OkHttpClient;

import java.util.List;
import java.util.Locale;

public class BinanceStreamClient extends AbstractExchangeStreamClient {

    private final ObjectMapper objectMapper;

    public BinanceStreamClient(OkHttpClient okHttpClient,
                               ExchangeFeedProperties properties,
                               ObjectMapper objectMapper,
                               PriceTickHandler tickHandler,
                               MeterRegistry meterRegistry) {
        super(okHttpClient, properties, new BinanceTickerDecoder(objectMapper), tickHandler, meterRegistry);
        this.objectMapper = objectMapper;
    }

    @Override
    public Exchange exchange() {
        return Exchange.BINANCE;
    }

    @Override
    protected List<String> subscribeMessages(List<String> symbols) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("method", "SUBSCRIBE");
        ArrayNode params = message.putArray("params");
        symbols.forEach(symbol -> params.add(symbol.toLowerCase(Locale.ROOT) + "@ticker"));
        message.put("id", 1);
        return List.of(message.toString());
    }

    @Override
    protected String heartbeatMessage() {
        return null;
    }
}
