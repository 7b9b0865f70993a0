package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.domain.model.FeedIdentity;
import com.eventpod.crawler.domain.model.LiveStatus;
import com.eventpod.crawler.domain.model.PriceTick;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CryptoEventCommandFactory Tests")
class CryptoEventCommandFactoryTest {

    private static final FeedIdentity IDENTITY = new FeedIdentity("cat-crypto", "eco-binance", "lang-en");

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T23:59:30Z"), ZoneOffset.UTC);
    private final CryptoEventCommandFactory factory = new CryptoEventCommandFactory(clock);

    @Test
    @DisplayName("Should derive keys, scores and texts from the tick")
    void testCommandShape() {
        EventUpsertCommand command = factory.create(Exchange.BINANCE, IDENTITY, new PriceTick("BTCUSDT", "65000.50"));

        assertThat(command.getExternalId()).isEqualTo("BINANCE_BTCUSDT");
        assertThat(command.getPeriodCode()).isEqualTo("CRYPTO_BINANCE__2024-03-01");
        assertThat(command.getPeriodScheduled()).isEqualTo("2024-03-01 23:59:30");
        assertThat(command.getPeriodRemark()).isEqualTo("Crypto price date: 2024-03-01");
        assertThat(command.getMainScore()).isEqualTo("65000.50");
        assertThat(command.getClusterScore()).isEqualTo("0");
        assertThat(command.getPrice()).isEqualTo("65000.50");
        assertThat(command.getLiveStatus()).isEqualTo(LiveStatus.LIVE);
        assertThat(command.getStage()).isEqualTo("LIVE");
        assertThat(command.getTitle()).isEqualTo("BTCUSDT Price");
        assertThat(command.getRules()).isEqualTo("Real-time price tracking for BTCUSDT on Binance");
        assertThat(command.isSports()).isFalse();
        assertThat(command.isOnlineOnCreate()).isFalse();
        assertThat(command.getOnlineOverride()).isNull();
        assertThat(command.getHomeTeam()).isNull();
        assertThat(command.getInfo())
                .containsEntry("external_id", "BINANCE_BTCUSDT")
                .containsEntry("exchange", "BINANCE")
                .containsEntry("symbol", "BTCUSDT")
                .containsEntry("price", "65000.50")
                .containsEntry("timestamp", Instant.parse("2024-03-01T23:59:30Z").getEpochSecond());
    }

    @Test
    @DisplayName("Should key the same symbol separately per exchange")
    void testPerExchangeKeys() {
        PriceTick tick = new PriceTick("ETHUSDT", "3500");

        assertThat(factory.create(Exchange.BYBIT, IDENTITY, tick).getExternalId()).isEqualTo("BYBIT_ETHUSDT");
        assertThat(factory.create(Exchange.OKX, IDENTITY, tick).getPeriodCode()).isEqualTo("CRYPTO_OKX__2024-03-01");
        assertThat(factory.create(Exchange.OKX, IDENTITY, tick).getRules()).endsWith("on OKX");
    }
}
