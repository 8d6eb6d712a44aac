package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.TestCatalogs;
import com.smartwealth.sectors.discovery.http.SourceFetchException;
import com.smartwealth.sectors.discovery.model.CandidateSet;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.NameKind;
import com.smartwealth.sectors.discovery.model.RetrievalStrategy;
import com.smartwealth.sectors.discovery.model.StrategyFailure;
import com.smartwealth.sectors.discovery.model.TickerCandidate;
import com.smartwealth.sectors.discovery.source.ScreenerScrapeSource;
import com.smartwealth.sectors.discovery.source.SourceRegistry;
import com.smartwealth.sectors.discovery.util.ReasonCodeClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TickerCollectorTest {
    private static final SourceRegistry REGISTRY = new SourceRegistry(TestCatalogs.bundled());

    @Mock
    private ScreenerScrapeSource screenerScrapeSource;

    private final DiscoveryProperties properties = new DiscoveryProperties();

    @Test
    void unionsEveryStrategyAndKeepsFirstProvenance() {
        when(screenerScrapeSource.fetchSymbols(anyString())).thenReturn(List.of("NVDA", "aapl", "BRK.B", "TOOLONGX"));
        TickerCollector collector = new TickerCollector(REGISTRY, screenerScrapeSource, properties);

        CandidateSet set = collector.collect(DiscoveryRequest.of(List.of("Technology"), List.of(), 20, false));

        assertThat(set.candidates()).extracting(TickerCandidate::symbol).startsWith("NVDA", "AAPL", "BRK-B", "MSFT");
        assertThat(set.candidates().get(1).source()).isInstanceOf(RetrievalStrategy.ScreenerScrape.class);
        assertThat(set.candidates().get(3).source().label()).isEqualTo("curated:sector_companies");
        assertThat(set.candidates()).extracting(TickerCandidate::symbol).doesNotHaveDuplicates().contains("SNOW");
        assertThat(set.candidates()).extracting(TickerCandidate::discoveryIndex)
            .containsExactlyElementsOf(java.util.stream.IntStream.range(0, set.candidates().size()).boxed().toList());
        assertThat(set.invalidSymbolsDropped()).isEqualTo(1);
        assertThat(set.strategies()).contains("curated:sector_companies", "curated:finnhub")
            .doesNotContain("fallback:Technology");
        assertThat(set.usedGlobalFallback()).isFalse();
    }

    @Test
    void failingScreenerIsRecordedAndCollectionContinues() {
        when(screenerScrapeSource.fetchSymbols(anyString()))
            .thenThrow(new SourceFetchException(ReasonCodeClassifier.HTTP_429_RATE_LIMIT, "rate limited"));
        TickerCollector collector = new TickerCollector(REGISTRY, screenerScrapeSource, properties);

        CandidateSet set = collector.collect(DiscoveryRequest.of(List.of("Technology"), List.of(), 20, false));

        assertThat(set.candidates()).extracting(TickerCandidate::symbol).startsWith("AAPL", "MSFT", "GOOGL");
        assertThat(set.strategyFailures()).extracting(StrategyFailure::reasonCode)
            .containsExactly(ReasonCodeClassifier.HTTP_429_RATE_LIMIT);
        assertThat(set.strategyFailures().get(0).requestedName()).isEqualTo("Technology");
    }

    @Test
    void capsCandidatesToLimitTimesMultiplierInInsertionOrder() {
        when(screenerScrapeSource.fetchSymbols(anyString())).thenThrow(new SourceFetchException(ReasonCodeClassifier.TIMEOUT, "slow"));
        TickerCollector collector = new TickerCollector(REGISTRY, screenerScrapeSource, properties);

        CandidateSet set = collector.collect(DiscoveryRequest.of(List.of("Technology"), List.of(), 2, false));

        assertThat(set.candidates()).extracting(TickerCandidate::symbol)
            .containsExactly("AAPL", "MSFT", "GOOGL", "AMZN", "NVDA", "META");
        assertThat(set.uncappedSize()).isGreaterThan(6);
    }

    @Test
    void unknownSubsectorUsesEveryCatchAllFallback() {
        when(screenerScrapeSource.fetchSymbols(anyString())).thenThrow(new SourceFetchException(ReasonCodeClassifier.HTTP_5XX, "down"));
        TickerCollector collector = new TickerCollector(REGISTRY, screenerScrapeSource, properties);

        CandidateSet set = collector.collect(DiscoveryRequest.of(List.of(), List.of("Quantum Widgets"), 10, false));

        assertThat(set.strategies()).containsExactly(
            "fallback:Technology",
            "fallback:Healthcare",
            "fallback:Financial Services"
        );
        assertThat(set.candidates()).hasSize(30);
        assertThat(set.candidates()).extracting(TickerCandidate::symbol).contains("AAPL", "JNJ", "JPM");
        assertThat(set.strategyFailures()).hasSize(3);
        assertThat(set.usedGlobalFallback()).isFalse();
    }

    @Test
    void emptyUnionTriggersGlobalFallback() {
        SourceRegistry emptyRegistry = mock(SourceRegistry.class);
        RetrievalStrategy screener = new RetrievalStrategy.ScreenerScrape("https://example.test/screener/nothing");
        when(emptyRegistry.chainsFor("Nowhere", NameKind.SECTOR)).thenReturn(List.of(List.of(screener)));
        when(emptyRegistry.globalFallbackStrategies()).thenReturn(REGISTRY.globalFallbackStrategies());
        when(emptyRegistry.secondaryStrategiesFor("Nowhere")).thenReturn(List.of());
        when(screenerScrapeSource.fetchSymbols("https://example.test/screener/nothing")).thenReturn(List.of());
        TickerCollector collector = new TickerCollector(emptyRegistry, screenerScrapeSource, properties);

        CandidateSet set = collector.collect(DiscoveryRequest.of(List.of("Nowhere"), List.of(), 10, false));

        assertThat(set.usedGlobalFallback()).isTrue();
        assertThat(set.candidates()).hasSize(30);
        assertThat(set.strategyFailures()).extracting(StrategyFailure::reasonCode)
            .containsExactly(ReasonCodeClassifier.EMPTY_RESULT);
        assertThat(set.strategies()).first().isEqualTo("fallback:Technology");
    }
}
