package com.eventpod.crawler.domain.model;

public record TeamRef(String externalId, String name, String alias) {

    public TeamRef {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("team externalId must not be blank");
        }
    }
}
