package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.http.SourceFetchException;
import com.smartwealth.sectors.discovery.model.CandidateSet;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.FailureTier;
import com.smartwealth.sectors.discovery.model.NameKind;
import com.smartwealth.sectors.discovery.model.RetrievalStrategy;
import com.smartwealth.sectors.discovery.model.StrategyFailure;
import com.smartwealth.sectors.discovery.model.TickerCandidate;
import com.smartwealth.sectors.discovery.source.ScreenerScrapeSource;
import com.smartwealth.sectors.discovery.source.SourceRegistry;
import com.smartwealth.sectors.discovery.util.ReasonCodeClassifier;
import com.smartwealth.sectors.discovery.util.TickerSymbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class TickerCollector {
    private static final Logger log = LoggerFactory.getLogger(TickerCollector.class);

    private final SourceRegistry sourceRegistry;
    private final ScreenerScrapeSource screenerScrapeSource;
    private final DiscoveryProperties properties;

    public TickerCollector(
        SourceRegistry sourceRegistry,
        ScreenerScrapeSource screenerScrapeSource,
        DiscoveryProperties properties
    ) {
        this.sourceRegistry = sourceRegistry;
        this.screenerScrapeSource = screenerScrapeSource;
        this.properties = properties;
    }

    public CandidateSet collect(DiscoveryRequest request) {
        Accumulator accumulator = new Accumulator();

        for (String sector : request.sectors()) {
            runChains(sector, sourceRegistry.chainsFor(sector, NameKind.SECTOR), accumulator);
        }
        for (String subsector : request.subsectors()) {
            runChains(subsector, sourceRegistry.chainsFor(subsector, NameKind.SUBSECTOR), accumulator);
        }

        boolean usedGlobalFallback = false;
        if (accumulator.candidates.isEmpty()) {
            log.info("No candidates from requested sources, using global fallback tier={}", FailureTier.EMPTY_CANDIDATE_SET);
            usedGlobalFallback = true;
            for (RetrievalStrategy strategy : sourceRegistry.globalFallbackStrategies()) {
                runStrategy("global", strategy, accumulator);
            }
        }

        for (String name : requestedNames(request)) {
            for (RetrievalStrategy strategy : sourceRegistry.secondaryStrategiesFor(name)) {
                runStrategy(name, strategy, accumulator);
            }
        }

        int cap = request.limit() * properties.getCollector().getCandidateMultiplier();
        List<TickerCandidate> all = new ArrayList<>(accumulator.candidates.values());
        List<TickerCandidate> capped = all.size() > cap ? all.subList(0, cap) : all;

        log.info(
            "Collected candidates={} uncapped={} cap={} strategies={} strategyFailures={} invalidDropped={} globalFallback={}",
            capped.size(),
            all.size(),
            cap,
            accumulator.strategies.size(),
            accumulator.failures.size(),
            accumulator.invalidDropped,
            usedGlobalFallback
        );
        return new CandidateSet(
            capped,
            new ArrayList<>(accumulator.strategies),
            accumulator.failures,
            usedGlobalFallback,
            accumulator.invalidDropped,
            all.size()
        );
    }

    private void runChains(String name, List<List<RetrievalStrategy>> chains, Accumulator accumulator) {
        for (List<RetrievalStrategy> chain : chains) {
            runChain(name, chain, accumulator);
        }
    }

    private void runChain(String name, List<RetrievalStrategy> chain, Accumulator accumulator) {
        int producedInChain = 0;
        for (RetrievalStrategy strategy : chain) {
            if (strategy.fallbackOnly() && producedInChain > 0) {
                continue;
            }
            producedInChain += runStrategy(name, strategy, accumulator);
        }
    }

    /** Returns how many symbols the strategy produced before validation and dedup. */
    private int runStrategy(String name, RetrievalStrategy strategy, Accumulator accumulator) {
        List<String> symbols;
        try {
            symbols = execute(strategy);
        } catch (SourceFetchException e) {
            recordFailure(accumulator, name, strategy, e.reasonCode(), e.getMessage());
            return 0;
        } catch (RuntimeException e) {
            recordFailure(accumulator, name, strategy, ReasonCodeClassifier.UNKNOWN, e.getMessage());
            return 0;
        }
        if (symbols.isEmpty()) {
            recordFailure(accumulator, name, strategy, ReasonCodeClassifier.EMPTY_RESULT, "strategy returned no symbols");
            return 0;
        }
        accumulator.strategies.add(strategy.label());
        for (String raw : symbols) {
            accumulator.add(raw, strategy);
        }
        return symbols.size();
    }

    private List<String> execute(RetrievalStrategy strategy) {
        if (strategy instanceof RetrievalStrategy.ScreenerScrape screener) {
            return screenerScrapeSource.fetchSymbols(screener.url());
        }
        if (strategy instanceof RetrievalStrategy.CuratedList curated) {
            return curated.tickers();
        }
        if (strategy instanceof RetrievalStrategy.StaticFallback fallback) {
            return fallback.tickers();
        }
        throw new IllegalArgumentException("Unsupported strategy " + strategy);
    }

    private void recordFailure(Accumulator accumulator, String name, RetrievalStrategy strategy, String reasonCode, String message) {
        accumulator.failures.add(new StrategyFailure(name, strategy.label(), reasonCode, message));
        log.warn(
            "Strategy failed tier={} name={} strategy={} reason={} retryable={} message={}",
            FailureTier.STRATEGY_FAILURE,
            name,
            strategy.label(),
            reasonCode,
            ReasonCodeClassifier.isRetryable(reasonCode),
            message
        );
    }

    private List<String> requestedNames(DiscoveryRequest request) {
        List<String> names = new ArrayList<>(request.sectors());
        names.addAll(request.subsectors());
        return names;
    }

    private static final class Accumulator {
        private final Map<String, TickerCandidate> candidates = new LinkedHashMap<>();
        private final Set<String> strategies = new LinkedHashSet<>();
        private final List<StrategyFailure> failures = new ArrayList<>();
        private int invalidDropped;

        void add(String raw, RetrievalStrategy strategy) {
            String symbol = TickerSymbols.normalizeValid(raw);
            if (symbol == null) {
                invalidDropped++;
                return;
            }
            if (!candidates.containsKey(symbol)) {
                candidates.put(symbol, new TickerCandidate(symbol, strategy, candidates.size()));
            }
        }
    }
}
