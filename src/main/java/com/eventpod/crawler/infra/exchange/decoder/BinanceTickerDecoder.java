package com.eventpod.crawler.infra.exchange.decoder;

import com.eventpod.crawler.infra.exchange.dto.BinanceTickerEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class BinanceTickerDecoder implements TickerDecoder {

    private static final String TICKER_EVENT = "24hrTicker";

    private final ObjectMapper objectMapper;

    @Override
    public DecodedFrame decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodedFrame.malformed("invalid json: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return DecodedFrame.malformed("not a json object");
        }

        if (root.has("error")) {
            return DecodedFrame.rejected(root.get("error").toString());
        }
        if (root.has("id") && root.has("result")) {
            return DecodedFrame.subscribed("id=" + root.get("id").asText());
        }

        JsonNode data = root.has("data") ? root.get("data") : root;
        if (!TICKER_EVENT.equals(data.path("e").asText())) {
            return DecodedFrame.ignored("event=" + data.path("e").asText());
        }

        BinanceTickerEvent event;
        try {
            event = objectMapper.treeToValue(data, BinanceTickerEvent.class);
        } catch (JsonProcessingException e) {
            return DecodedFrame.malformed("invalid ticker: " + e.getOriginalMessage());
        }
        if (isBlank(event.getLastPrice())) {
            return DecodedFrame.malformed("empty price in ticker data");
        }
        if (isBlank(event.getSymbol())) {
            return DecodedFrame.malformed("missing symbol in ticker data");
        }
        return DecodedFrame.tick(event.getSymbol(), event.getLastPrice());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
