package com.smartwealth.sectors.discovery.api;

import java.util.List;

public record CatalogResponse(
    String version,
    List<String> sectors,
    List<String> subsectors
) {
}
