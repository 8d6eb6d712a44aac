package com.smartwealth.sectors.discovery.model;

public record EnrichmentResult(
    TickerCandidate candidate,
    QuoteRecord record,
    String reasonCode,
    String errorMessage
) {
    public static EnrichmentResult success(TickerCandidate candidate, QuoteRecord record) {
        return new EnrichmentResult(candidate, record, null, null);
    }

    public static EnrichmentResult failure(TickerCandidate candidate, String reasonCode, String errorMessage) {
        return new EnrichmentResult(candidate, null, reasonCode, errorMessage);
    }

    public boolean isSuccessful() {
        return record != null;
    }
}
