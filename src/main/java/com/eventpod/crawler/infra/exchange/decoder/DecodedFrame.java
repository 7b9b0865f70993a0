package com.eventpod.crawler.infra.exchange.decoder;

import com.eventpod.crawler.domain.model.PriceTick;

public record DecodedFrame(Kind kind, PriceTick tick, String detail) {

    public enum Kind {
        TICK,
        SUBSCRIBED,
        REJECTED,
        CONTROL,
        IGNORED,
        MALFORMED
    }

    public static DecodedFrame tick(String symbol, String price) {
        return new DecodedFrame(Kind.TICK, new PriceTick(symbol, price), null);
    }

    public static DecodedFrame subscribed(String detail) {
        return new DecodedFrame(Kind.SUBSCRIBED, null, detail);
    }

    public static DecodedFrame rejected(String detail) {
        return new DecodedFrame(Kind.REJECTED, null, detail);
    }

    public static DecodedFrame control(String detail) {
        return new DecodedFrame(Kind.CONTROL, null, detail);
    }

    public static DecodedFrame ignored(String detail) {
        return new DecodedFrame(Kind.IGNORED, null, detail);
    }

    public static DecodedFrame malformed(String detail) {
        return new DecodedFrame(Kind.MALFORMED, null, detail);
    }
}
