package com.smartwealth.sectors.discovery.model;

public enum FailureTier {
    STRATEGY_FAILURE,
    ENRICHMENT_FAILURE,
    EMPTY_CANDIDATE_SET,
    CATASTROPHIC_FAILURE
}
