package com.eventpod.crawler.infra.exchange.decoder;

public interface TickerDecoder {

    DecodedFrame decode(String text);
}
