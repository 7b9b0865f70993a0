package com.eventpod.crawler.infra.http;

import com.eventpod.crawler.infra.retry.ErrorClass;
import com.eventpod.crawler.infra.retry.ErrorClassifier;

public final class HttpErrorClassifier implements ErrorClassifier {

    public static final HttpErrorClassifier INSTANCE = new HttpErrorClassifier();

    private HttpErrorClassifier() {
    }

    @Override
    public ErrorClass classify(Exception e) {
        if (e instanceof HttpStatusException statusException && statusException.isClientError()) {
            return ErrorClass.TERMINAL;
        }
        return ErrorClass.RETRYABLE;
    }
}
