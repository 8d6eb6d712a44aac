package com.smartwealth.sectors.discovery.source;

import com.smartwealth.sectors.discovery.TestCatalogs;
import com.smartwealth.sectors.discovery.model.NameKind;
import com.smartwealth.sectors.discovery.model.RetrievalStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRegistryTest {
    private final SourceRegistry registry = new SourceRegistry(TestCatalogs.bundled());

    @Test
    void knownSectorRunsScreenerThenCuratedThenFallback() {
        List<RetrievalStrategy> strategies = registry.strategiesFor("technology", NameKind.SECTOR);

        assertThat(strategies).hasSize(3);
        assertThat(strategies.get(0)).isEqualTo(
            new RetrievalStrategy.ScreenerScrape("https://finance.yahoo.com/screener/predefined/ms_technology")
        );
        assertThat(strategies.get(1).label()).isEqualTo("curated:sector_companies");
        assertThat(strategies.get(2)).isInstanceOf(RetrievalStrategy.StaticFallback.class);
        assertThat(strategies.get(2).fallbackOnly()).isTrue();
    }

    @Test
    void knownSubsectorUsesParentScreenersAndFallback() {
        List<RetrievalStrategy> strategies = registry.strategiesFor("Semiconductors", NameKind.SUBSECTOR);

        assertThat(strategies).extracting(RetrievalStrategy::label).containsExactly(
            "screener:https://finance.yahoo.com/screener/predefined/ms_technology",
            "curated:subsector_companies",
            "fallback:Technology"
        );
    }

    @Test
    void unknownNameResolvesThroughIndustryKeywords() {
        List<RetrievalStrategy> strategies = registry.strategiesFor("Offshore Oil Drilling", NameKind.SUBSECTOR);

        assertThat(strategies).extracting(RetrievalStrategy::label).containsExactly(
            "screener:https://finance.yahoo.com/screener/predefined/ms_energy",
            "fallback:Energy"
        );
    }

    @Test
    void unmatchedNameFallsBackToCatchAllSectors() {
        List<RetrievalStrategy> strategies = registry.strategiesFor("Quantum Widgets", NameKind.SUBSECTOR);

        assertThat(strategies).extracting(RetrievalStrategy::label).containsExactly(
            "screener:https://finance.yahoo.com/screener/predefined/ms_technology",
            "fallback:Technology",
            "screener:https://finance.yahoo.com/screener/predefined/ms_healthcare",
            "fallback:Healthcare",
            "screener:https://finance.yahoo.com/screener/predefined/ms_financial_services",
            "fallback:Financial Services"
        );
    }

    @Test
    void secondaryStrategiesMatchByContainment() {
        assertThat(registry.secondaryStrategiesFor("Technology"))
            .extracting(RetrievalStrategy::label)
            .containsExactly("curated:alpha_vantage", "curated:iex", "curated:finnhub", "curated:curated");
        assertThat(registry.secondaryStrategiesFor("Utilities"))
            .extracting(RetrievalStrategy::label)
            .containsExactly("curated:iex");
        assertThat(registry.secondaryStrategiesFor("Quantum Widgets")).isEmpty();
    }

    @Test
    void globalFallbackCoversEveryBroadSector() {
        assertThat(registry.globalFallbackStrategies()).hasSize(11)
            .allMatch(RetrievalStrategy::fallbackOnly);
    }

    @Test
    void catchAllKeepsOneChainPerBroadSector() {
        List<List<RetrievalStrategy>> chains = registry.chainsFor("Quantum Widgets", NameKind.SUBSECTOR);

        assertThat(chains).hasSize(3);
        assertThat(chains.get(1)).extracting(RetrievalStrategy::label).containsExactly(
            "screener:https://finance.yahoo.com/screener/predefined/ms_healthcare",
            "fallback:Healthcare"
        );
    }

    @Test
    void knownSectorIsASingleChain() {
        assertThat(registry.chainsFor("Energy", NameKind.SECTOR)).hasSize(1);
    }
}
