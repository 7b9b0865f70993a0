package com.eventpod.crawler.infra.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryExecutor Tests")
class RetryExecutorTest {

    private static final BackoffPolicy NO_DELAY = attempt -> Duration.ZERO;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should return the first successful result without retrying")
    void testSucceedsFirstTry() {
        AtomicInteger calls = new AtomicInteger();

        String result = RetryExecutor.execute(new RetryPolicy(3, NO_DELAY, ErrorClassifier.ALWAYS_RETRY), () -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry transient failures and return once the call succeeds")
    void testRetriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = RetryExecutor.execute(new RetryPolicy(3, NO_DELAY, ErrorClassifier.ALWAYS_RETRY), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should give up after maxAttempts and carry the last error")
    void testExhaustsAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryExecutor.execute(
                new RetryPolicy(3, NO_DELAY, ErrorClassifier.ALWAYS_RETRY), () -> {
                    calls.incrementAndGet();
                    throw new IOException("boom " + calls.get());
                }))
                .isInstanceOf(RetryExhaustedException.class)
                .hasRootCauseMessage("boom 3")
                .satisfies(e -> {
                    RetryExhaustedException ex = (RetryExhaustedException) e;
                    assertThat(ex.getAttempts()).isEqualTo(3);
                    assertThat(ex.isTerminal()).isFalse();
                });
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should stop immediately on a terminal error")
    void testTerminalStopsRetrying() {
        AtomicInteger calls = new AtomicInteger();
        ErrorClassifier terminalOnIllegalArgument =
                e -> e instanceof IllegalArgumentException ? ErrorClass.TERMINAL : ErrorClass.RETRYABLE;

        assertThatThrownBy(() -> RetryExecutor.execute(
                new RetryPolicy(5, NO_DELAY, terminalOnIllegalArgument), () -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("bad request");
                }))
                .isInstanceOfSatisfying(RetryExhaustedException.class, e -> {
                    assertThat(e.isTerminal()).isTrue();
                    assertThat(e.getAttempts()).isEqualTo(1);
                });
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not call at all when the thread is already interrupted")
    void testInterruptedBeforeFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> RetryExecutor.execute(
                new RetryPolicy(3, NO_DELAY, ErrorClassifier.ALWAYS_RETRY), () -> calls.incrementAndGet()))
                .isInstanceOf(RetryExhaustedException.class);
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Should reject a policy with fewer than one attempt")
    void testInvalidPolicy() {
        assertThatThrownBy(() -> new RetryPolicy(0, NO_DELAY, ErrorClassifier.ALWAYS_RETRY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
