package com.eventpod.crawler.domain.model;

public enum Exchange {

    BINANCE("Binance"),
    BYBIT("Bybit"),
    OKX("OKX");

    private final String displayName;

    Exchange(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public String externalIdFor(String symbol) {
        return name() + "_" + symbol;
    }

    public String periodCodeFor(String dateCode) {
        return "CRYPTO_" + name() + "__" + dateCode;
    }
}
