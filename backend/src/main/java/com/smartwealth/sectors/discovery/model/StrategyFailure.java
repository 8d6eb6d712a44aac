package com.smartwealth.sectors.discovery.model;

public record StrategyFailure(
    String requestedName,
    String strategyLabel,
    String reasonCode,
    String message
) {
}
