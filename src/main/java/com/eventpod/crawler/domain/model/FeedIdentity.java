package com.eventpod.crawler.domain.model;

public record FeedIdentity(String categoryGuid, String ecosystemGuid, String languageGuid) {
}
