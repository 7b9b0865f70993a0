package com.eventpod.crawler.infra.exchange.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class BybitTickerDecoder implements TickerDecoder {

    static final String TOPIC_PREFIX = "tickers.";

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

        if (root.has("op")) {
            String op = root.path("op").asText();
            boolean success = root.path("success").asBoolean(true);
            if ("subscribe".equals(op)) {
                return success
                        ? DecodedFrame.subscribed("conn_id=" + root.path("conn_id").asText())
                        : DecodedFrame.rejected(root.path("ret_msg").asText());
            }
            return DecodedFrame.control("op=" + op);
        }

        String topic = root.path("topic").asText("");
        if (!topic.startsWith(TOPIC_PREFIX)) {
            return DecodedFrame.ignored("topic=" + topic);
        }

        JsonNode data = root.path("data");
        String price = firstNonBlank(data.path("lastPrice").asText(""), data.path("last_price").asText(""));
        if (price.isEmpty()) {
            return DecodedFrame.ignored("no price in " + topic);
        }

        String symbol = firstNonBlank(data.path("symbol").asText(""), topic.substring(TOPIC_PREFIX.length()));
        if (symbol.isEmpty()) {
            return DecodedFrame.malformed("cannot extract symbol from topic " + topic);
        }
        return DecodedFrame.tick(symbol, price);
    }

    private static String firstNonBlank(String first, String second) {
        return !first.isBlank() ? first : second;
    }
}
