package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.discovery.source.SectorSourceCatalog;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Decides whether a quote's reported sector fits the requested sectors.
 * Records without a reported sector are accepted.
 */
@Component
public class RelevanceFilter {
    private static final String UNKNOWN_SECTOR = "unknown";

    private final List<List<String>> synonymGroups;

    public RelevanceFilter(SectorSourceCatalog catalog) {
        this.synonymGroups = catalog.synonymGroups().stream()
            .map(group -> group.stream().map(SectorSourceCatalog::key).toList())
            .toList();
    }

    public boolean isRelevant(Collection<String> requestedSectors, String recordSector) {
        if (requestedSectors == null || requestedSectors.isEmpty()) {
            return true;
        }
        String actual = SectorSourceCatalog.key(recordSector);
        if (actual.isEmpty() || actual.equals(UNKNOWN_SECTOR)) {
            return true;
        }
        for (String requested : requestedSectors) {
            String wanted = SectorSourceCatalog.key(requested);
            if (wanted.isEmpty()) {
                continue;
            }
            if (wanted.equals(actual) || wanted.contains(actual) || actual.contains(wanted)) {
                return true;
            }
            if (sameSynonymGroup(wanted, actual)) {
                return true;
            }
        }
        return false;
    }

    private boolean sameSynonymGroup(String left, String right) {
        for (List<String> group : synonymGroups) {
            if (group.contains(left) && group.contains(right)) {
                return true;
            }
        }
        return false;
    }
}
