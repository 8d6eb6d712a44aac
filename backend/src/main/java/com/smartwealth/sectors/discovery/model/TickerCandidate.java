package com.smartwealth.sectors.discovery.model;

public record TickerCandidate(
    String symbol,
    RetrievalStrategy source,
    int discoveryIndex
) {
}
