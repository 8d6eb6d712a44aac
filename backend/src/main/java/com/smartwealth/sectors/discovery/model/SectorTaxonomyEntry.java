package com.smartwealth.sectors.discovery.model;

import java.util.List;

public record SectorTaxonomyEntry(
    String name,
    List<String> screenerIds,
    List<String> fallbackTickers
) {
    public SectorTaxonomyEntry {
        screenerIds = screenerIds == null ? List.of() : List.copyOf(screenerIds);
        fallbackTickers = fallbackTickers == null ? List.of() : List.copyOf(fallbackTickers);
    }
}
