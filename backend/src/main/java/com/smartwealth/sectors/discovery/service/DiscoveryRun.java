package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.discovery.model.DiscoveryRunState;

import java.util.UUID;

/**
 * Lifecycle of a single pipeline invocation. States only move forward.
 */
public class DiscoveryRun {
    private final String runId;
    private DiscoveryRunState state = DiscoveryRunState.IDLE;

    public DiscoveryRun() {
        this(UUID.randomUUID().toString());
    }

    public DiscoveryRun(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public synchronized DiscoveryRunState state() {
        return state;
    }

    public void startCollecting() {
        transition(DiscoveryRunState.IDLE, DiscoveryRunState.COLLECTING);
    }

    public void startEnriching() {
        transition(DiscoveryRunState.COLLECTING, DiscoveryRunState.ENRICHING);
    }

    public void complete() {
        transition(DiscoveryRunState.ENRICHING, DiscoveryRunState.COMPLETED);
    }

    public synchronized void fail() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already finished as " + state);
        }
        state = DiscoveryRunState.FAILED;
    }

    private synchronized void transition(DiscoveryRunState expected, DiscoveryRunState next) {
        if (state != expected) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + state + " to " + next);
        }
        state = next;
    }
}
