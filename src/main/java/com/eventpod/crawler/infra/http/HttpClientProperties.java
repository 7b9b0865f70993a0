package com.eventpod.crawler.infra.http;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crawler.http")
public class HttpClientProperties {

    private long connectTimeoutMs = 10_000;

    private long writeTimeoutMs = 10_000;

    private long callTimeoutMs = 30_000;

    private long pingIntervalMs = 20_000;
}
