package com.smartwealth.sectors.discovery.model;

public record AcceptedCompany(
    TickerCandidate candidate,
    QuoteRecord record
) {
}
