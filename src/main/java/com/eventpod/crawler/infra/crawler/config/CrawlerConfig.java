package com.eventpod.crawler.infra.crawler.config;

import com.eventpod.crawler.infra.http.HttpClientProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class CrawlerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // no read timeout: stream sockets stay idle between pushes
    @Bean
    public OkHttpClient okHttpClient(HttpClientProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(properties.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)
                .callTimeout(properties.getCallTimeoutMs(), TimeUnit.MILLISECONDS)
                .pingInterval(properties.getPingIntervalMs(), TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }
}
