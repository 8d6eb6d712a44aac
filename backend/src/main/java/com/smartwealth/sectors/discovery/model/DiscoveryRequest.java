package com.smartwealth.sectors.discovery.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record DiscoveryRequest(
    List<String> sectors,
    List<String> subsectors,
    int limit,
    boolean streaming
) {
    public DiscoveryRequest {
        sectors = sectors == null ? List.of() : List.copyOf(sectors);
        subsectors = subsectors == null ? List.of() : List.copyOf(subsectors);
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static DiscoveryRequest of(List<String> sectors, List<String> subsectors, int limit, boolean streaming) {
        return new DiscoveryRequest(distinctNames(sectors), distinctNames(subsectors), limit, streaming);
    }

    public boolean isEmpty() {
        return sectors.isEmpty() && subsectors.isEmpty();
    }

    private static List<String> distinctNames(List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String trimmed = name.trim();
            byKey.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
        }
        return new ArrayList<>(byKey.values());
    }
}
