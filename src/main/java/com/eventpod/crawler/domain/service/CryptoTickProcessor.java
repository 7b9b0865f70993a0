package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.domain.model.FeedIdentity;
import com.eventpod.crawler.domain.model.PriceTick;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CryptoTickProcessor {

    private final CryptoEventCommandFactory commandFactory;
    private final EventUpsertService upsertService;

    public EventUpsertResult process(Exchange exchange, FeedIdentity identity, PriceTick tick) {
        return upsertService.upsert(commandFactory.create(exchange, identity, tick));
    }
}
