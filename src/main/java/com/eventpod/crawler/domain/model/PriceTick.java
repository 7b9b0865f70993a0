package com.eventpod.crawler.domain.model;

public record PriceTick(String symbol, String price) {

    public PriceTick {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (price == null || price.isBlank()) {
            throw new IllegalArgumentException("price must not be blank");
        }
    }
}
