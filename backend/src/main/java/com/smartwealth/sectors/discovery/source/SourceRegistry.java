package com.smartwealth.sectors.discovery.source;

import com.smartwealth.sectors.discovery.model.IndustryKeyword;
import com.smartwealth.sectors.discovery.model.NameKind;
import com.smartwealth.sectors.discovery.model.RetrievalStrategy;
import com.smartwealth.sectors.discovery.model.SectorTaxonomyEntry;
import com.smartwealth.sectors.discovery.model.SubsectorEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a requested sector or subsector name to its ordered retrieval strategies.
 * Pure lookups over the catalog; unknown names never fail, they resolve to a broader chain.
 */
@Component
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final SectorSourceCatalog catalog;

    public SourceRegistry(SectorSourceCatalog catalog) {
        this.catalog = catalog;
    }

    public List<RetrievalStrategy> strategiesFor(String name, NameKind kind) {
        List<RetrievalStrategy> strategies = new ArrayList<>();
        for (List<RetrievalStrategy> chain : chainsFor(name, kind)) {
            strategies.addAll(chain);
        }
        return strategies;
    }

    /**
     * Independent chains for a name. A resolved name has one chain; the catch-all has one per
     * broad sector so each keeps its own static fallback.
     */
    public List<List<RetrievalStrategy>> chainsFor(String name, NameKind kind) {
        Optional<SectorTaxonomyEntry> sector = catalog.findSector(name);
        if (sector.isPresent()) {
            return List.of(sectorChain(sector.get(), true));
        }
        Optional<SubsectorEntry> subsector = catalog.findSubsector(name);
        if (subsector.isPresent()) {
            return List.of(subsectorChain(subsector.get()));
        }
        Optional<SectorTaxonomyEntry> byKeyword = matchIndustryKeyword(name);
        if (byKeyword.isPresent()) {
            log.debug("Resolved unknown {} name={} by keyword to sector={}", kind, name, byKeyword.get().name());
            return List.of(sectorChain(byKeyword.get(), false));
        }
        log.debug("No keyword matched {} name={}, using catch-all sectors {}", kind, name, catalog.catchAllSectors());
        return catchAllChains();
    }

    public List<RetrievalStrategy> secondaryStrategiesFor(String name) {
        String lowered = SectorSourceCatalog.key(name);
        if (lowered.isEmpty()) {
            return List.of();
        }
        List<RetrievalStrategy> strategies = new ArrayList<>();
        for (String provider : catalog.secondaryProviders()) {
            for (Map.Entry<String, List<String>> entry : catalog.curatedTable(provider).entrySet()) {
                String key = entry.getKey();
                if (key.contains(lowered) || lowered.contains(key)) {
                    strategies.add(new RetrievalStrategy.CuratedList(provider, entry.getValue()));
                    break;
                }
            }
        }
        return strategies;
    }

    public List<RetrievalStrategy> globalFallbackStrategies() {
        List<RetrievalStrategy> strategies = new ArrayList<>();
        for (SectorTaxonomyEntry sector : catalog.sectors()) {
            if (!sector.fallbackTickers().isEmpty()) {
                strategies.add(new RetrievalStrategy.StaticFallback(sector.name(), sector.fallbackTickers()));
            }
        }
        return strategies;
    }

    public List<String> knownSectors() {
        return catalog.sectors().stream().map(SectorTaxonomyEntry::name).toList();
    }

    public List<String> knownSubsectors() {
        return catalog.subsectors().stream().map(SubsectorEntry::name).toList();
    }

    public String catalogVersion() {
        return catalog.version();
    }

    private List<RetrievalStrategy> sectorChain(SectorTaxonomyEntry sector, boolean includeCurated) {
        List<RetrievalStrategy> strategies = new ArrayList<>(screeners(sector));
        if (includeCurated) {
            List<String> curated = catalog.curated(SectorSourceCatalog.SECTOR_COMPANIES, sector.name());
            if (!curated.isEmpty()) {
                strategies.add(new RetrievalStrategy.CuratedList(SectorSourceCatalog.SECTOR_COMPANIES, curated));
            }
        }
        addFallback(strategies, sector);
        return strategies;
    }

    private List<RetrievalStrategy> subsectorChain(SubsectorEntry subsector) {
        Optional<SectorTaxonomyEntry> parent = catalog.findSector(subsector.sector());
        List<RetrievalStrategy> strategies = new ArrayList<>();
        parent.ifPresent(sector -> strategies.addAll(screeners(sector)));
        List<String> curated = catalog.curated(SectorSourceCatalog.SUBSECTOR_COMPANIES, subsector.name());
        if (!curated.isEmpty()) {
            strategies.add(new RetrievalStrategy.CuratedList(SectorSourceCatalog.SUBSECTOR_COMPANIES, curated));
        }
        if (parent.isPresent()) {
            addFallback(strategies, parent.get());
        } else {
            log.warn("Subsector {} references unknown sector {}", subsector.name(), subsector.sector());
        }
        return strategies;
    }

    private List<List<RetrievalStrategy>> catchAllChains() {
        List<List<RetrievalStrategy>> chains = new ArrayList<>();
        for (String name : catalog.catchAllSectors()) {
            catalog.findSector(name).ifPresent(sector -> chains.add(sectorChain(sector, false)));
        }
        return chains;
    }

    private Optional<SectorTaxonomyEntry> matchIndustryKeyword(String name) {
        String lowered = SectorSourceCatalog.key(name);
        if (lowered.isEmpty()) {
            return Optional.empty();
        }
        for (IndustryKeyword keyword : catalog.industryKeywords()) {
            if (keyword.keyword() != null && lowered.contains(SectorSourceCatalog.key(keyword.keyword()))) {
                Optional<SectorTaxonomyEntry> sector = catalog.findSector(keyword.sector());
                if (sector.isPresent()) {
                    return sector;
                }
            }
        }
        return Optional.empty();
    }

    private List<RetrievalStrategy> screeners(SectorTaxonomyEntry sector) {
        List<RetrievalStrategy> strategies = new ArrayList<>();
        for (String screenerId : sector.screenerIds()) {
            strategies.add(new RetrievalStrategy.ScreenerScrape(catalog.screenerBaseUrl() + screenerId));
        }
        return strategies;
    }

    private void addFallback(List<RetrievalStrategy> strategies, SectorTaxonomyEntry sector) {
        if (!sector.fallbackTickers().isEmpty()) {
            strategies.add(new RetrievalStrategy.StaticFallback(sector.name(), sector.fallbackTickers()));
        }
    }
}
