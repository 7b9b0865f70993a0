package com.eventpod.crawler.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crawler.upsert")
public class EventUpsertProperties {

    private int timeoutSeconds = 10;
}
