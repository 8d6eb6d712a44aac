package com.smartwealth.sectors.discovery.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartwealth.sectors.discovery.model.CompanyView;

import java.time.Instant;
import java.util.List;

public record DiscoveryResponse(
    List<String> sectors,
    List<String> subsectors,
    List<CompanyView> companies,
    @JsonProperty("company_count") int companyCount,
    int limit,
    int considered,
    int accepted,
    int rejected,
    List<String> strategies,
    @JsonProperty("last_updated") Instant lastUpdated
) {
}
