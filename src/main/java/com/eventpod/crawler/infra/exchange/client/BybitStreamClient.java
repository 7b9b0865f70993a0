package com.eventpod.crawler.infra.exchange.client;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.infra.exchange.config.ExchangeFeedProperties;
import com.eventpod.crawler.infra.exchange.decoder.BybitTickerDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.OkHttpClient;

import java.util.List;
import java.util.Locale;

public class BybitStreamClient extends AbstractExchangeStreamClient {

    private static final String PING = "{\"op\":\"ping\"}";

    private final ObjectMapper objectMapper;

    public BybitStreamClient(OkHttpClient okHttpClient,
                             ExchangeFeedProperties properties,
                             ObjectMapper objectMapper,
                             PriceTickHandler tickHandler,
                             MeterRegistry meterRegistry) {
        super(okHttpClient, properties, new BybitTickerDecoder(objectMapper), tickHandler, meterRegistry);
        this.objectMapper = objectMapper;
    }

    @Override
    public Exchange exchange() {
        return Exchange.BYBIT;
    }

    @Override
    protected List<String> subscribeMessages(List<String> symbols) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("op", "subscribe");
        ArrayNode args = message.putArray("args");
        symbols.forEach(symbol -> args.add("tickers." + symbol.toUpperCase(Locale.ROOT)));
        return List.of(message.toString());
    }

    @Override
    protected String heartbeatMessage() {
        return PING;
    }
}
