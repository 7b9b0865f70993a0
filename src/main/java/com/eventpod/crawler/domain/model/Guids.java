package com.eventpod.crawler.domain.model;

import java.util.UUID;

final class Guids {

    private Guids() {
    }

    static String newGuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
