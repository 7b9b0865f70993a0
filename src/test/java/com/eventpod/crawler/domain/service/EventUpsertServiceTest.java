package com.eventpod.crawler.domain.service;

import com.eventpod.crawler.domain.model.Event;
import com.eventpod.crawler.domain.model.EventLanguage;
import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.domain.model.FeedIdentity;
import com.eventpod.crawler.domain.model.GameUpdate;
import com.eventpod.crawler.domain.model.LiveStatus;
import com.eventpod.crawler.domain.model.PriceTick;
import com.eventpod.crawler.domain.model.TeamRef;
import com.eventpod.crawler.domain.repository.EventLanguageRepository;
import com.eventpod.crawler.domain.repository.EventPeriodRepository;
import com.eventpod.crawler.domain.repository.EventRepository;
import com.eventpod.crawler.domain.repository.TeamGroupLanguageRepository;
import com.eventpod.crawler.domain.repository.TeamGroupRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("EventUpsertService Tests")
class EventUpsertServiceTest {

    private static final FeedIdentity CRYPTO = new FeedIdentity("cat-crypto", "eco-binance", "lang-en");
    private static final FeedIdentity NBA = new FeedIdentity("cat-sports", "eco-nba", "lang-en");
    private static final TeamRef LAKERS = new TeamRef("team-lal", "Lakers", "LAL");
    private static final TeamRef CELTICS = new TeamRef("team-bos", "Celtics", "BOS");

    @Autowired
    private EventRepository eventRepository;
    @Autowired
    private EventLanguageRepository eventLanguageRepository;
    @Autowired
    private EventPeriodRepository eventPeriodRepository;
    @Autowired
    private TeamGroupRepository teamGroupRepository;
    @Autowired
    private TeamGroupLanguageRepository teamGroupLanguageRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    private EventUpsertService upsertService;
    private CryptoEventCommandFactory cryptoFactory;
    private NbaEventCommandFactory nbaFactory;

    @BeforeEach
    void setUp() {
        eventLanguageRepository.deleteAll();
        eventRepository.deleteAll();
        eventPeriodRepository.deleteAll();
        teamGroupLanguageRepository.deleteAll();
        teamGroupRepository.deleteAll();

        upsertService = new EventUpsertService(
                eventRepository,
                eventLanguageRepository,
                new EventPeriodResolver(eventPeriodRepository, transactionManager),
                new TeamGroupResolver(teamGroupRepository, teamGroupLanguageRepository, transactionManager),
                transactionManager,
                new EventUpsertProperties());
        cryptoFactory = new CryptoEventCommandFactory(
                Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
        nbaFactory = new NbaEventCommandFactory();
    }

    @Test
    @DisplayName("Should create a crypto event with its language row on the first tick")
    void testNewCryptoEvent() {
        EventUpsertResult result = upsertService.upsert(
                cryptoFactory.create(Exchange.BINANCE, CRYPTO, new PriceTick("BTCUSDT", "65000.50")));

        assertThat(result.created()).isTrue();
        Event event = eventRepository.findByExternalId("BINANCE_BTCUSDT").orElseThrow();
        assertThat(event.getGuid()).hasSize(32).doesNotContain("-");
        assertThat(event.getMainScore()).isEqualTo("65000.50");
        assertThat(event.getClusterScore()).isEqualTo("0");
        assertThat(event.getPrice()).isEqualTo("65000.50");
        assertThat(event.getLiveStatus()).isEqualTo(LiveStatus.LIVE);
        assertThat(event.getStage()).isEqualTo("LIVE");
        assertThat(event.isOnline()).isFalse();
        assertThat(event.isSports()).isFalse();
        assertThat(event.getMainTeamGroupGuid()).isEqualTo(Event.NO_TEAM);
        assertThat(event.getCategoryGuid()).isEqualTo("cat-crypto");

        EventLanguage language = eventLanguageRepository
                .findByEventGuidAndLanguageGuid(event.getGuid(), "lang-en").orElseThrow();
        assertThat(language.getTitle()).isEqualTo("BTCUSDT Price");
        assertThat(language.getRules()).isEqualTo("Real-time price tracking for BTCUSDT on Binance");

        assertThat(eventPeriodRepository.findByCode("CRYPTO_BINANCE__2024-03-01"))
                .get()
                .satisfies(period -> assertThat(period.getGuid()).isEqualTo(event.getEventPeriodGuid()));
    }

    @Test
    @DisplayName("Should update in place when the same natural key is upserted again")
    void testIdempotentUpsert() {
        EventUpsertResult first = upsertService.upsert(
                cryptoFactory.create(Exchange.BINANCE, CRYPTO, new PriceTick("BTCUSDT", "65000.50")));
        EventUpsertResult second = upsertService.upsert(
                cryptoFactory.create(Exchange.BINANCE, CRYPTO, new PriceTick("BTCUSDT", "65100.00")));

        assertThat(second.created()).isFalse();
        assertThat(second.eventGuid()).isEqualTo(first.eventGuid());
        assertThat(eventRepository.countByExternalId("BINANCE_BTCUSDT")).isEqualTo(1);
        assertThat(eventLanguageRepository.countByEventGuid(first.eventGuid())).isEqualTo(1);
        assertThat(eventPeriodRepository.countByCode("CRYPTO_BINANCE__2024-03-01")).isEqualTo(1);

        Event event = eventRepository.findByExternalId("BINANCE_BTCUSDT").orElseThrow();
        assertThat(event.getMainScore()).isEqualTo("65100.00");
        assertThat(event.getPrice()).isEqualTo("65100.00");
    }

    @Test
    @DisplayName("Should share one period across symbols of the same exchange and day")
    void testPeriodConvergence() {
        upsertService.upsert(cryptoFactory.create(Exchange.BINANCE, CRYPTO, new PriceTick("BTCUSDT", "65000")));
        upsertService.upsert(cryptoFactory.create(Exchange.BINANCE, CRYPTO, new PriceTick("ETHUSDT", "3500")));

        Event btc = eventRepository.findByExternalId("BINANCE_BTCUSDT").orElseThrow();
        Event eth = eventRepository.findByExternalId("BINANCE_ETHUSDT").orElseThrow();
        assertThat(btc.getEventPeriodGuid()).isEqualTo(eth.getEventPeriodGuid());
        assertThat(eventPeriodRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should leave visibility untouched when a crypto event is updated")
    void testCryptoUpdateKeepsVisibility() {
        upsertService.upsert(cryptoFactory.create(Exchange.BYBIT, CRYPTO, new PriceTick("BTCUSDT", "65000")));
        Event published = eventRepository.findByExternalId("BYBIT_BTCUSDT").orElseThrow();
        published.setOnline(true);
        eventRepository.save(published);

        upsertService.upsert(cryptoFactory.create(Exchange.BYBIT, CRYPTO, new PriceTick("BTCUSDT", "65001")));

        assertThat(eventRepository.findByExternalId("BYBIT_BTCUSDT").orElseThrow().isOnline()).isTrue();
    }

    @Test
    @DisplayName("Should move a sports event from scheduled to finished and publish it")
    void testSportsTransition() {
        upsertService.upsert(nbaFactory.create(NBA, game("scheduled", null, null)));

        Event scheduled = eventRepository.findByExternalId("game-1").orElseThrow();
        assertThat(scheduled.getLiveStatus()).isEqualTo(LiveStatus.SCHEDULED);
        assertThat(scheduled.getStage()).isEqualTo("Q1");
        assertThat(scheduled.isOnline()).isFalse();
        assertThat(scheduled.isSports()).isTrue();
        assertThat(scheduled.getMainScore()).isEqualTo("0");

        upsertService.upsert(nbaFactory.create(NBA, game("closed", 102, 98)));

        Event closed = eventRepository.findByExternalId("game-1").orElseThrow();
        assertThat(closed.getGuid()).isEqualTo(scheduled.getGuid());
        assertThat(closed.getMainScore()).isEqualTo("102");
        assertThat(closed.getClusterScore()).isEqualTo("98");
        assertThat(closed.getLiveStatus()).isEqualTo(LiveStatus.FINISHED);
        assertThat(closed.getStage()).isEqualTo("FT");
        assertThat(closed.isOnline()).isTrue();
        assertThat(eventRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should create each team once and reuse it across games")
    void testTeamReuse() {
        upsertService.upsert(nbaFactory.create(NBA, game("scheduled", null, null)));
        upsertService.upsert(nbaFactory.create(NBA, new GameUpdate("game-2", "scheduled", "2024-01-17T01:00:00Z",
                CELTICS, LAKERS, null, null, "REG", Map.of())));

        assertThat(teamGroupRepository.count()).isEqualTo(2);
        assertThat(teamGroupLanguageRepository.count()).isEqualTo(2);

        Event first = eventRepository.findByExternalId("game-1").orElseThrow();
        Event second = eventRepository.findByExternalId("game-2").orElseThrow();
        assertThat(first.getMainTeamGroupGuid()).isEqualTo(second.getClusterTeamGroupGuid());
        assertThat(first.getClusterTeamGroupGuid()).isEqualTo(second.getMainTeamGroupGuid());

        String lakersGuid = teamGroupRepository.findByExternalIdAndEcosystemGuid("team-lal", "eco-nba")
                .orElseThrow().getGuid();
        assertThat(teamGroupLanguageRepository.findByTeamGroupGuidAndLanguageGuid(lakersGuid, "lang-en"))
                .get()
                .satisfies(name -> {
                    assertThat(name.getName()).isEqualTo("Lakers");
                    assertThat(name.getAlias()).isEqualTo("LAL");
                });
    }

    @Test
    @DisplayName("Should roll back the event and surface EventUpsertException when a write fails")
    void testFailureRollsBack() {
        EventUpsertCommand tooLongTitle = EventUpsertCommand.builder()
                .externalId("BINANCE_BROKEN")
                .categoryGuid("cat-crypto")
                .ecosystemGuid("eco-binance")
                .languageGuid("lang-en")
                .periodCode("CRYPTO_BINANCE__2024-03-01")
                .periodScheduled("2024-03-01 10:00:00")
                .periodRemark("Crypto price date: 2024-03-01")
                .mainScore("1")
                .clusterScore("0")
                .price("1")
                .liveStatus(LiveStatus.LIVE)
                .stage("LIVE")
                .info(Map.of())
                .title("x".repeat(500))
                .rules("")
                .build();

        assertThatThrownBy(() -> upsertService.upsert(tooLongTitle))
                .isInstanceOf(EventUpsertException.class)
                .hasMessageContaining("BINANCE_BROKEN");
        assertThat(eventRepository.findByExternalId("BINANCE_BROKEN")).isEmpty();
        assertThat(eventLanguageRepository.count()).isZero();
    }

    private static GameUpdate game(String status, Integer home, Integer away) {
        return new GameUpdate("game-1", status, "2024-01-15T19:30:00Z", LAKERS, CELTICS,
                home, away, "REG", Map.of("coverage", "full"));
    }
}
