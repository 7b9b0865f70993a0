package com.eventpod.crawler.infra.http;

import lombok.Getter;

@Getter
public class HttpStatusException extends RuntimeException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String url, String body) {
        super(String.format("HTTP %d from %s: %s", statusCode, url, body));
        this.statusCode = statusCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
