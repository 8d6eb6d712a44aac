package com.smartwealth.sectors.discovery.model;

import java.time.Instant;

public record QuoteRecord(
    String ticker,
    String name,
    Double price,
    Long marketCap,
    Double peRatio,
    String sector,
    String industry,
    Long volume,
    Long avgVolume,
    Double priceChangePct,
    Instant fetchedAt
) {
    public long marketCapOrZero() {
        return marketCap == null ? 0L : marketCap;
    }
}
