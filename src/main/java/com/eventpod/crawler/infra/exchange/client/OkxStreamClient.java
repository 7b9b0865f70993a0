package com.eventpod.crawler.infra.exchange.client;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.infra.exchange.config.ExchangeFeedProperties;
import com.eventpod.crawler.infra.exchange.decoder.OkxTickerDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.OkHttpClient;

import java.util.List;

public class OkxStreamClient extends AbstractExchangeStreamClient {

    private final ObjectMapper objectMapper;

    public OkxStreamClient(OkHttpClient okHttpClient,
                           ExchangeFeedProperties properties,
                           ObjectMapper objectMapper,
                           PriceTickHandler tickHandler,
                           MeterRegistry meterRegistry) {
        super(okHttpClient, properties, new OkxTickerDecoder(objectMapper), tickHandler, meterRegistry);
        this.objectMapper = objectMapper;
    }

    @Override
    public Exchange exchange() {
        return Exchange.OKX;
    }

    @Override
    protected List<String> subscribeMessages(List<String> symbols) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("op", "subscribe");
        ArrayNode args = message.putArray("args");
        for (String symbol : symbols) {
            args.addObject()
                    .put("channel", "tickers")
                    .put("instId", OkxTickerDecoder.toInstrumentId(symbol));
        }
        return List.of(message.toString());
    }

    @Override
    protected String heartbeatMessage() {
        return "ping";
    }
}
