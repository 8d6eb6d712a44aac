package com.smartwealth.sectors.discovery.api;

import java.util.List;

public record DiscoveryApiRequest(
    List<String> sectors,
    List<String> subsectors,
    Integer limit,
    Boolean streaming
) {
}
