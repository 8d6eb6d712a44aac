package com.smartwealth.sectors.discovery.model;

import java.util.List;

public record CandidateSet(
    List<TickerCandidate> candidates,
    List<String> strategies,
    List<StrategyFailure> strategyFailures,
    boolean usedGlobalFallback,
    int invalidSymbolsDropped,
    int uncappedSize
) {
    public CandidateSet {
        candidates = List.copyOf(candidates);
        strategies = List.copyOf(strategies);
        strategyFailures = List.copyOf(strategyFailures);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
