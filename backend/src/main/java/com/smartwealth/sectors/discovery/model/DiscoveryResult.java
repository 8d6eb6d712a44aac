package com.smartwealth.sectors.discovery.model;

import java.util.List;

public record DiscoveryResult(
    String runId,
    List<AcceptedCompany> companies,
    int considered,
    int accepted,
    int rejected,
    int enrichmentFailed,
    int candidateCount,
    List<String> strategies,
    int strategyFailureCount,
    boolean usedGlobalFallback
) {
    public DiscoveryResult {
        companies = List.copyOf(companies);
        strategies = List.copyOf(strategies);
    }
}
