package com.eventpod.crawler.infra.exchange.client;

import com.eventpod.crawler.domain.model.Exchange;
import com.eventpod.crawler.domain.model.PriceTick;
import com.eventpod.crawler.infra.crawler.FeedAdapter;
import com.eventpod.crawler.infra.crawler.FeedStartException;
import com.eventpod.crawler.infra.exchange.config.ExchangeFeedProperties;
import com.eventpod.crawler.infra.exchange.decoder.DecodedFrame;
import com.eventpod.crawler.infra.exchange.decoder.TickerDecoder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ticks are passed to the {@link PriceTickHandler} inline on OkHttp's reader thread, so a slow handler slows the reads.
 */
@Slf4j
public abstract class AbstractExchangeStreamClient implements FeedAdapter {

    private final OkHttpClient okHttpClient;
    private final ExchangeFeedProperties properties;
    private final TickerDecoder decoder;
    private final PriceTickHandler tickHandler;
    private final ReconnectBackoff backoff;
    private final String logTag;

    private final Counter processedCounter;
    private final Counter droppedCounter;
    private final Counter malformedCounter;
    private final Counter reconnectCounter;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private final AtomicInteger generation = new AtomicInteger();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> heartbeatTask;
    private WebSocket webSocket;

    protected AbstractExchangeStreamClient(OkHttpClient okHttpClient,
                                           ExchangeFeedProperties properties,
                                           TickerDecoder decoder,
                                           PriceTickHandler tickHandler,
                                           MeterRegistry meterRegistry) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
        this.decoder = decoder;
        this.tickHandler = tickHandler;
        this.backoff = properties.newReconnectBackoff();
        this.logTag = "[" + exchange().displayName() + " WS]";

        String feed = exchange().name().toLowerCase();
        this.processedCounter = Counter.builder("crawler.ticks.processed")
                .tag("feed", feed)
                .description("Ticks persisted through the upsert step")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("crawler.ticks.dropped")
                .tag("feed", feed)
                .tag("reason", "upsert")
                .description("Ticks dropped because the upsert failed")
                .register(meterRegistry);
        this.malformedCounter = Counter.builder("crawler.ticks.dropped")
                .tag("feed", feed)
                .tag("reason", "decode")
                .description("Frames dropped because they could not be decoded")
                .register(meterRegistry);
        this.reconnectCounter = Counter.builder("crawler.reconnects")
                .tag("feed", feed)
                .description("Scheduled WebSocket reconnects")
                .register(meterRegistry);
    }

    public abstract Exchange exchange();

    protected abstract List<String> subscribeMessages(List<String> symbols);

    @Nullable
    protected abstract String heartbeatMessage();

    @Override
    public String name() {
        return exchange().name();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                throw new FeedStartException(exchange().displayName() + " WebSocket stream is already running");
            }
            validateConfiguration();

            running.set(true);
            backoff.reset();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "ws-" + exchange().name().toLowerCase());
                thread.setDaemon(true);
                return thread;
            });
            connect();
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.getAndSet(false)) {
                return;
            }
            generation.incrementAndGet();
            cancelHeartbeat();
            if (webSocket != null) {
                webSocket.close(1000, "Stream stopped");
                webSocket.cancel();
                webSocket = null;
            }
            connected.set(false);
            subscribed.set(false);
            scheduler.shutdownNow();
        }
        log.info("{} 스트림 중지 완료", logTag);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    public boolean isSubscribed() {
        return subscribed.get();
    }

    public Duration currentReconnectDelay() {
        return backoff.peek();
    }

    private void validateConfiguration() {
        if (properties.getSymbols() == null || properties.getSymbols().isEmpty()) {
            throw new FeedStartException("no symbols configured for " + exchange().displayName());
        }
        String url = properties.getWsUrl();
        String httpForm = url == null ? null : url.replaceFirst("^(?i)ws:", "http:").replaceFirst("^(?i)wss:", "https:");
        if (httpForm == null || HttpUrl.parse(httpForm) == null) {
            throw new FeedStartException("invalid WebSocket url for " + exchange().displayName() + ": " + url);
        }
    }

    private void connect() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            int connectionId = generation.incrementAndGet();
            subscribed.set(false);
            log.info("{} 연결 시도: {}", logTag, properties.getWsUrl());

            Request request = new Request.Builder()
                    .url(properties.getWsUrl())
                    .build();
            webSocket = okHttpClient.newWebSocket(request, new StreamListener(connectionId));
        }
    }

    private void onConnectionLost(int connectionId, String reason, @Nullable Throwable cause) {
        synchronized (lifecycleLock) {
            if (connectionId != generation.get()) {
                return;
            }
            connected.set(false);
            subscribed.set(false);
            cancelHeartbeat();
            webSocket = null;

            if (!running.get()) {
                return;
            }

            Duration delay = backoff.nextDelay();
            reconnectCounter.increment();
            if (cause != null) {
                log.error("{} 연결 오류, {}ms 후 재연결: {}", logTag, delay.toMillis(), reason, cause);
            } else {
                log.warn("{} 연결 종료, {}ms 후 재연결: {}", logTag, delay.toMillis(), reason);
            }
            scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    void startHeartbeat(WebSocket ws) {
        synchronized (lifecycleLock) {
            cancelHeartbeat();
            String heartbeat = heartbeatMessage();
            if (heartbeat == null || !running.get()) {
                return;
            }
            long interval = properties.getHeartbeatIntervalMs();
            heartbeatTask = scheduler.scheduleAtFixedRate(() -> sendHeartbeat(ws, heartbeat),
                    interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    void sendHeartbeat(WebSocket ws, String heartbeat) {
        if (!ws.send(heartbeat)) {
            log.warn("{} 하트비트 전송 실패, 연결 강제 종료", logTag);
            ws.cancel();
        }
    }

    private void cancelHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    private void markSubscribed(String detail) {
        if (subscribed.compareAndSet(false, true)) {
            backoff.reset();
            log.info("{} 구독 완료: {}", logTag, detail);
        }
    }

    private void handleFrame(WebSocket ws, String text) {
        DecodedFrame frame = decoder.decode(text);
        switch (frame.kind()) {
            case TICK -> {
                markSubscribed("첫 티커 수신");
                deliver(frame.tick());
            }
            case SUBSCRIBED -> markSubscribed(frame.detail());
            case REJECTED -> {
                log.error("{} 구독 거부: {}", logTag, frame.detail());
                ws.cancel();
            }
            case CONTROL, IGNORED -> log.debug("{} 비티커 프레임 무시: {}", logTag, frame.detail());
            case MALFORMED -> {
                malformedCounter.increment();
                log.warn("{} 프레임 디코딩 실패 ({}): {}", logTag, frame.detail(), text);
            }
        }
    }

    private void deliver(PriceTick tick) {
        try {
            tickHandler.onTick(tick);
            processedCounter.increment();
            log.debug("{} 가격 반영: symbol={}, price={}", logTag, tick.symbol(), tick.price());
        } catch (RuntimeException e) {
            droppedCounter.increment();
            log.error("{} 가격 반영 실패, 드롭 후 계속 진행: symbol={}, price={}",
                    logTag, tick.symbol(), tick.price(), e);
        }
    }

    private class StreamListener extends WebSocketListener {

        private final int connectionId;

        StreamListener(int connectionId) {
            this.connectionId = connectionId;
        }

        @Override
        public void onOpen(@NotNull WebSocket ws, @NotNull Response response) {
            if (connectionId != generation.get()) {
                ws.cancel();
                return;
            }
            connected.set(true);
            log.info("{} 연결 성공 (code={})", logTag, response.code());

            for (String message : subscribeMessages(properties.getSymbols())) {
                if (!ws.send(message)) {
                    log.error("{} 구독 메시지 전송 실패", logTag);
                    ws.cancel();
                    return;
                }
            }
            log.info("{} 구독 요청 전송: symbols={}", logTag, properties.getSymbols());

            synchronized (lifecycleLock) {
                if (connectionId == generation.get() && running.get() && connected.get()) {
                    startHeartbeat(ws);
                }
            }
        }

        @Override
        public void onMessage(@NotNull WebSocket ws, @NotNull String text) {
            if (connectionId != generation.get()) {
                return;
            }
            handleFrame(ws, text);
        }

        @Override
        public void onClosing(@NotNull WebSocket ws, int code, @NotNull String reason) {
            log.info("{} 서버 연결 종료 요청 (code={}, reason={})", logTag, code, reason);
            ws.close(1000, null);
        }

        @Override
        public void onClosed(@NotNull WebSocket ws, int code, @NotNull String reason) {
            onConnectionLost(connectionId, "closed code=" + code + " reason=" + reason, null);
        }

        @Override
        public void onFailure(@NotNull WebSocket ws, @NotNull Throwable t, @Nullable Response response) {
            onConnectionLost(connectionId, t.getMessage(), t);
        }
    }
}
