package com.eventpod.crawler.infra.http;

import com.eventpod.crawler.infra.exchange.dto.BinanceTickerPrice;
import com.eventpod.crawler.infra.retry.RetryExhaustedException;
import com.eventpod.crawler.infra.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonHttpClient Tests")
class JsonHttpClientTest {

    private static final RetryPolicy THREE_FAST_ATTEMPTS =
            new RetryPolicy(3, attempt -> Duration.ZERO, HttpErrorClassifier.INSTANCE);

    private MockWebServer server;
    private JsonHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new JsonHttpClient(new OkHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should decode the body and send the given headers")
    void testDecodesBody() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("{\"symbol\":\"BTCUSDT\",\"price\":\"65000.50\"}"));

        BinanceTickerPrice price = client.get(server.url("/ticker").toString(),
                Map.of("x-api-key", "secret"), BinanceTickerPrice.class, THREE_FAST_ATTEMPTS);

        assertThat(price.getPrice()).isEqualTo("65000.50");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("x-api-key")).isEqualTo("secret");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    @DisplayName("Should retry 5xx responses until one succeeds")
    void testRetriesServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setBody("{\"symbol\":\"BTCUSDT\",\"price\":\"1\"}"));

        BinanceTickerPrice price = client.get(server.url("/ticker").toString(),
                Map.of(), BinanceTickerPrice.class, THREE_FAST_ATTEMPTS);

        assertThat(price.getPrice()).isEqualTo("1");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should not retry 4xx responses")
    void testClientErrorIsTerminal() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}"));

        assertThatThrownBy(() -> client.get(server.url("/ticker").toString(),
                Map.of(), BinanceTickerPrice.class, THREE_FAST_ATTEMPTS))
                .isInstanceOfSatisfying(RetryExhaustedException.class, e -> {
                    assertThat(e.isTerminal()).isTrue();
                    assertThat(e.getCause()).isInstanceOf(HttpStatusException.class);
                    assertThat(((HttpStatusException) e.getCause()).getStatusCode()).isEqualTo(400);
                });
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should give up after the configured attempts on persistent 5xx")
    void testExhaustsOnServerErrors() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(502));
        }

        assertThatThrownBy(() -> client.get(server.url("/ticker").toString(),
                Map.of(), BinanceTickerPrice.class, THREE_FAST_ATTEMPTS))
                .isInstanceOfSatisfying(RetryExhaustedException.class,
                        e -> assertThat(e.getAttempts()).isEqualTo(3));
        assertThat(server.getRequestCount()).isEqualTo(3);
    }
}
