package com.eventpod.crawler.infra.exchange.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Locale;

@RequiredArgsConstructor
public class OkxTickerDecoder implements TickerDecoder {

    static final String CHANNEL = "tickers";

    private static final List<String> QUOTE_CURRENCIES = List.of("USDT", "USDC", "BTC", "ETH", "BNB", "USD");

    private final ObjectMapper objectMapper;

    public static String toInstrumentId(String symbol) {
        String upper = symbol.toUpperCase(Locale.ROOT);
        for (String quote : QUOTE_CURRENCIES) {
            if (upper.endsWith(quote) && upper.length() > quote.length()) {
                return upper.substring(0, upper.length() - quote.length()) + "-" + quote;
            }
        }
        return upper;
    }

    public static String fromInstrumentId(String instId) {
        return instId.replace("-", "");
    }

    @Override
    public DecodedFrame decode(String text) {
        if ("pong".equals(text)) {
            return DecodedFrame.control("pong");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodedFrame.malformed("invalid json: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return DecodedFrame.malformed("not a json object");
        }

        if (root.has("event")) {
            String event = root.path("event").asText();
            return switch (event) {
                case "subscribe" -> DecodedFrame.subscribed("instId=" + root.path("arg").path("instId").asText());
                case "error" -> DecodedFrame.rejected(
                        "code=" + root.path("code").asText() + ", msg=" + root.path("msg").asText());
                default -> DecodedFrame.control("event=" + event);
            };
        }

        JsonNode arg = root.path("arg");
        if (!CHANNEL.equals(arg.path("channel").asText())) {
            return DecodedFrame.ignored("channel=" + arg.path("channel").asText());
        }

        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return DecodedFrame.ignored("empty data");
        }

        JsonNode ticker = data.get(0);
        String price = ticker.path("last").asText("");
        if (price.isBlank()) {
            return DecodedFrame.malformed("empty price in ticker data");
        }

        String instId = ticker.path("instId").asText("");
        if (instId.isBlank()) {
            instId = arg.path("instId").asText("");
        }
        if (instId.isBlank()) {
            return DecodedFrame.malformed("missing instId");
        }
        return DecodedFrame.tick(fromInstrumentId(instId), price);
    }
}
