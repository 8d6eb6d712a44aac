package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.discovery.model.AcceptedCompany;

@FunctionalInterface
public interface DiscoveryListener {
    DiscoveryListener NONE = (company, index) -> { };

    /** Called on the run thread for each accepted company, in discovery order; index is 1-based. */
    void onAccepted(AcceptedCompany company, int index);
}
