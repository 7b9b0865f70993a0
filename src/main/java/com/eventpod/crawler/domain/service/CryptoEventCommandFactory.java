package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.domain.model.FeedIdentity;
import com.eventpod.crawler.domain.model.LiveStatus;
import com.eventpod.crawler.domain.model.PriceTick;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CryptoEventCommandFactory {

    static final String STAGE_LIVE = "LIVE";

    private static final DateTimeFormatter DATE_CODE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter SCHEDULED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public EventUpsertCommand create(Exchange exchange, FeedIdentity identity, PriceTick tick) {
        LocalDateTime now = LocalDateTime.now(clock);
        String dateCode = now.format(DATE_CODE);
        String externalId = exchange.externalIdFor(tick.symbol());

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("external_id", externalId);
        info.put("exchange", exchange.name());
        info.put("symbol", tick.symbol());
        info.put("price", tick.price());
        info.put("timestamp", clock.instant().getEpochSecond());

        return EventUpsertCommand.builder()
                .externalId(externalId)
                .categoryGuid(identity.categoryGuid())
                .ecosystemGuid(identity.ecosystemGuid())
                .languageGuid(identity.languageGuid())
                .periodCode(exchange.periodCodeFor(dateCode))
                .periodScheduled(now.format(SCHEDULED))
                .periodRemark("Crypto price date: " + dateCode)
                .mainScore(tick.price())
                .clusterScore("0")
                .price(tick.price())
                .liveStatus(LiveStatus.LIVE)
                .stage(STAGE_LIVE)
                .info(info)
                .title(tick.symbol() + " Price")
                .rules("Real-time price tracking for " + tick.symbol() + " on " + exchange.displayName())
                .sports(false)
                .onlineOnCreate(false)
                .build();
    }
}
