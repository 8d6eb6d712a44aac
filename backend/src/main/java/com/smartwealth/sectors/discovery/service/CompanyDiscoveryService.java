package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import com.smartwealth.sectors.discovery.model.CandidateSet;
import com.smartwealth.sectors.discovery.model.DiscoveryRequest;
import com.smartwealth.sectors.discovery.model.DiscoveryResult;
import com.smartwealth.sectors.discovery.model.EnrichmentResult;
import com.smartwealth.sectors.discovery.model.FailureTier;
import com.smartwealth.sectors.discovery.model.TickerCandidate;
import com.smartwealth.sectors.discovery.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class CompanyDiscoveryService {
    public static final String RUN_ID_MDC_KEY = "discoveryRunId";

    private static final Logger log = LoggerFactory.getLogger(CompanyDiscoveryService.class);

    private final TickerCollector tickerCollector;
    private final EnrichmentWorker enrichmentWorker;
    private final RelevanceFilter relevanceFilter;
    private final CompanyRanker companyRanker;
    private final DiscoveryProperties properties;
    private final ExecutorService enrichmentExecutor;

    public CompanyDiscoveryService(
        TickerCollector tickerCollector,
        EnrichmentWorker enrichmentWorker,
        RelevanceFilter relevanceFilter,
        CompanyRanker companyRanker,
        DiscoveryProperties properties,
        @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor
    ) {
        this.tickerCollector = tickerCollector;
        this.enrichmentWorker = enrichmentWorker;
        this.relevanceFilter = relevanceFilter;
        this.companyRanker = companyRanker;
        this.properties = properties;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    public DiscoveryResult discover(DiscoveryRequest request) {
        return discover(request, DiscoveryListener.NONE);
    }

    public DiscoveryResult discover(DiscoveryRequest request, DiscoveryListener listener) {
        if (request.isEmpty()) {
            throw new IllegalArgumentException("at least one sector or subsector is required");
        }
        DiscoveryRun run = new DiscoveryRun();
        String previousRunId = MDC.get(RUN_ID_MDC_KEY);
        MDC.put(RUN_ID_MDC_KEY, run.runId());
        try {
            log.info("Discovery started sectors={} subsectors={} limit={} streaming={}",
                request.sectors(), request.subsectors(), request.limit(), request.streaming());
            return execute(run, request, listener == null ? DiscoveryListener.NONE : listener);
        } catch (CatastrophicDiscoveryException e) {
            run.fail();
            log.warn("Discovery failed tier={} message={}", FailureTier.CATASTROPHIC_FAILURE, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            run.fail();
            log.warn("Discovery failed tier={}", FailureTier.CATASTROPHIC_FAILURE, e);
            throw new CatastrophicDiscoveryException("discovery run failed: " + e.getMessage(), e);
        } finally {
            restoreRunId(previousRunId);
        }
    }

    private DiscoveryResult execute(DiscoveryRun run, DiscoveryRequest request, DiscoveryListener listener) {
        run.startCollecting();
        CandidateSet candidateSet = tickerCollector.collect(request);
        if (candidateSet.isEmpty()) {
            throw new CatastrophicDiscoveryException("no candidate tickers available, even from the global fallback");
        }

        run.startEnriching();
        Tally tally = new Tally(request, listener);
        if (request.streaming()) {
            enrichWithEarlyTermination(run.runId(), candidateSet.candidates(), tally, request.limit());
        } else {
            enrichAll(run.runId(), candidateSet.candidates(), tally);
        }

        List<AcceptedCompany> ranked = companyRanker.rank(tally.accepted, request.limit());
        run.complete();
        log.info(
            "Discovery completed candidates={} considered={} accepted={} rejected={} enrichmentFailed={} returned={} strategyFailures={}",
            candidateSet.candidates().size(),
            tally.considered,
            tally.accepted.size(),
            tally.rejected,
            tally.enrichmentFailed,
            ranked.size(),
            candidateSet.strategyFailures().size()
        );
        return new DiscoveryResult(
            run.runId(),
            ranked,
            tally.considered,
            tally.accepted.size(),
            tally.rejected,
            tally.enrichmentFailed,
            candidateSet.candidates().size(),
            candidateSet.strategies(),
            candidateSet.strategyFailures().size(),
            candidateSet.usedGlobalFallback()
        );
    }

    private void enrichAll(String runId, List<TickerCandidate> candidates, Tally tally) {
        List<CompletableFuture<EnrichmentResult>> futures = new ArrayList<>();
        for (TickerCandidate candidate : candidates) {
            futures.add(submit(runId, candidate));
        }
        for (int i = 0; i < futures.size(); i++) {
            tally.evaluate(await(futures.get(i), candidates.get(i)));
        }
    }

    /**
     * Keeps at most {@code concurrency} enrichments in flight and stops scheduling once
     * {@code limit} companies are accepted. Results still in flight at that point are dropped.
     */
    private void enrichWithEarlyTermination(String runId, List<TickerCandidate> candidates, Tally tally, int limit) {
        int window = properties.getConcurrency();
        Deque<CompletableFuture<EnrichmentResult>> inFlight = new ArrayDeque<>();
        Deque<TickerCandidate> inFlightCandidates = new ArrayDeque<>();
        int next = 0;
        while (!companyRanker.isSaturated(tally.accepted.size(), limit)) {
            while (inFlight.size() < window && next < candidates.size()) {
                TickerCandidate candidate = candidates.get(next++);
                inFlight.addLast(submit(runId, candidate));
                inFlightCandidates.addLast(candidate);
            }
            if (inFlight.isEmpty()) {
                break;
            }
            tally.evaluate(await(inFlight.pollFirst(), inFlightCandidates.pollFirst()));
        }
        if (!inFlight.isEmpty()) {
            log.debug("Limit reached, discarding {} in-flight enrichments", inFlight.size());
            for (CompletableFuture<EnrichmentResult> future : inFlight) {
                future.handle((result, error) -> null).join();
            }
        }
    }

    private CompletableFuture<EnrichmentResult> submit(String runId, TickerCandidate candidate) {
        return CompletableFuture.supplyAsync(
            () -> {
                String previousRunId = MDC.get(RUN_ID_MDC_KEY);
                MDC.put(RUN_ID_MDC_KEY, runId);
                try {
                    return enrichmentWorker.enrich(candidate);
                } finally {
                    restoreRunId(previousRunId);
                }
            },
            enrichmentExecutor
        );
    }

    private EnrichmentResult await(CompletableFuture<EnrichmentResult> future, TickerCandidate candidate) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return EnrichmentResult.failure(candidate, ReasonCodeClassifier.UNKNOWN, cause.getMessage());
        }
    }

    private static void restoreRunId(String previousRunId) {
        if (previousRunId == null) {
            MDC.remove(RUN_ID_MDC_KEY);
        } else {
            MDC.put(RUN_ID_MDC_KEY, previousRunId);
        }
    }

    private final class Tally {
        private final DiscoveryRequest request;
        private final DiscoveryListener listener;
        private final List<AcceptedCompany> accepted = new ArrayList<>();
        private int considered;
        private int rejected;
        private int enrichmentFailed;

        private Tally(DiscoveryRequest request, DiscoveryListener listener) {
            this.request = request;
            this.listener = listener;
        }

        void evaluate(EnrichmentResult result) {
            considered++;
            if (!result.isSuccessful()) {
                enrichmentFailed++;
                return;
            }
            if (!relevanceFilter.isRelevant(request.sectors(), result.record().sector())) {
                rejected++;
                log.debug("Rejected ticker={} sector={} requested={}",
                    result.candidate().symbol(), result.record().sector(), request.sectors());
                return;
            }
            AcceptedCompany company = new AcceptedCompany(result.candidate(), result.record());
            accepted.add(company);
            listener.onAccepted(company, accepted.size());
        }
    }
}
