package com.smartwealth.sectors.discovery.model;

public enum DiscoveryRunState {
    IDLE,
    COLLECTING,
    ENRICHING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
