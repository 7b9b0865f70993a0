package com.eventpod.crawler.infra.exchange.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReconnectBackoff Tests")
class ReconnectBackoffTest {

    private ReconnectBackoff backoff;

    @BeforeEach
    void setUp() {
        backoff = new ReconnectBackoff(Duration.ofSeconds(5), Duration.ofSeconds(60), 1.5);
    }

    @Test
    @DisplayName("Should start at 5s and grow by 1.5x per failure")
    void testGrowthSequence() {
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(5_000));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(7_500));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(11_250));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(16_875));
    }

    @Test
    @DisplayName("Should be non-decreasing and never exceed 60s across consecutive failures")
    void testMonotonicAndCapped() {
        List<Duration> delays = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            delays.add(backoff.nextDelay());
        }

        for (int i = 1; i < delays.size(); i++) {
            assertThat(delays.get(i)).isGreaterThanOrEqualTo(delays.get(i - 1));
        }
        assertThat(delays).allSatisfy(d -> assertThat(d).isLessThanOrEqualTo(Duration.ofSeconds(60)));
        assertThat(delays.get(delays.size() - 1)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Should return to the initial delay after a successful subscription")
    void testReset() {
        backoff.nextDelay();
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertThat(backoff.peek()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
    }
}
