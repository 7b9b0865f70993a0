package com.eventpod.crawler.infra.sports.config;

import com.eventpod.crawler.domain.model.FeedIdentity;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crawler.nba")
public class NbaFeedProperties {

    private boolean enabled = true;

    private String apiKey;

    private String accessLevel = "trial";

    private String baseUrl;

    private String languageCode = "en";

    private String categoryGuid;

    private String ecosystemGuid;

    private String languageGuid;

    private long pollIntervalMs = 300_000;

    private int lookaheadDays = 0;

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl;
        }
        String level = accessLevel == null || accessLevel.isBlank() ? "trial" : accessLevel;
        return "https://api.sportradar.com/nba/" + level + "/v8";
    }

    public FeedIdentity identity() {
        return new FeedIdentity(categoryGuid, ecosystemGuid, languageGuid);
    }
}
