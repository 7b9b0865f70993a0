package com.eventpod.crawler.domain.service;

public record EventUpsertResult(String eventGuid, boolean created) {
}
