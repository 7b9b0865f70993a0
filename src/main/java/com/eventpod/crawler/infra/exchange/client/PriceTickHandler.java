package com.eventpod.crawler.infra.exchange.client;

import com.eventpod.crawler.domain.model.PriceTick;

@FunctionalInterface
public interface PriceTickHandler {

    void onTick(PriceTick tick);
}
