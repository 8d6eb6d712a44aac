package com.smartwealth.sectors.discovery.source;

import com.smartwealth.sectors.discovery.model.IndustryKeyword;
import com.smartwealth.sectors.discovery.model.SectorTaxonomyEntry;
import com.smartwealth.sectors.discovery.model.SubsectorEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned source configuration, loaded once at startup and never mutated.
 * Curated tables are keyed by provider id, then by lower-cased sector or subsector name.
 */
public record SectorSourceCatalog(
    String version,
    String screenerBaseUrl,
    List<SectorTaxonomyEntry> sectors,
    List<SubsectorEntry> subsectors,
    List<IndustryKeyword> industryKeywords,
    List<String> catchAllSectors,
    List<List<String>> synonymGroups,
    List<String> secondaryProviders,
    Map<String, Map<String, List<String>>> curatedTables
) {
    public static final String SECTOR_COMPANIES = "sector_companies";
    public static final String SUBSECTOR_COMPANIES = "subsector_companies";

    public SectorSourceCatalog {
        sectors = List.copyOf(sectors);
        subsectors = List.copyOf(subsectors);
        industryKeywords = List.copyOf(industryKeywords);
        catchAllSectors = List.copyOf(catchAllSectors);
        synonymGroups = synonymGroups.stream().map(List::copyOf).toList();
        secondaryProviders = List.copyOf(secondaryProviders);
        Map<String, Map<String, List<String>>> tables = new LinkedHashMap<>();
        curatedTables.forEach((provider, table) -> tables.put(provider, copyTable(table)));
        curatedTables = Collections.unmodifiableMap(tables);
    }

    public Optional<SectorTaxonomyEntry> findSector(String name) {
        String key = key(name);
        return sectors.stream()
            .filter(sector -> key(sector.name()).equals(key))
            .findFirst();
    }

    public Optional<SubsectorEntry> findSubsector(String name) {
        String key = key(name);
        return subsectors.stream()
            .filter(subsector -> key(subsector.name()).equals(key))
            .findFirst();
    }

    public List<String> curated(String providerId, String name) {
        Map<String, List<String>> table = curatedTables.get(providerId);
        if (table == null) {
            return List.of();
        }
        return table.getOrDefault(key(name), List.of());
    }

    public Map<String, List<String>> curatedTable(String providerId) {
        return curatedTables.getOrDefault(providerId, Map.of());
    }

    public static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, List<String>> copyTable(Map<String, List<String>> table) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        table.forEach((name, tickers) -> copy.put(key(name), List.copyOf(tickers)));
        return Collections.unmodifiableMap(copy);
    }
}
