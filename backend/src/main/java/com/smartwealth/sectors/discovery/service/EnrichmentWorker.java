package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.http.SourceFetchException;
import com.smartwealth.sectors.discovery.model.EnrichmentResult;
import com.smartwealth.sectors.discovery.model.FailureTier;
import com.smartwealth.sectors.discovery.model.QuoteRecord;
import com.smartwealth.sectors.discovery.model.TickerCandidate;
import com.smartwealth.sectors.discovery.quote.QuoteSource;
import com.smartwealth.sectors.discovery.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EnrichmentWorker {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentWorker.class);

    private final QuoteSource quoteSource;
    private final DiscoveryProperties properties;

    public EnrichmentWorker(QuoteSource quoteSource, DiscoveryProperties properties) {
        this.quoteSource = quoteSource;
        this.properties = properties;
    }

    public EnrichmentResult enrich(TickerCandidate candidate) {
        int delayMs = properties.getEnrichment().getDelayMs();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failed(candidate, ReasonCodeClassifier.UNKNOWN, "interrupted before quote fetch");
            }
        }

        QuoteRecord record;
        try {
            record = quoteSource.getQuote(candidate.symbol());
        } catch (SourceFetchException e) {
            return failed(candidate, e.reasonCode(), e.getMessage());
        } catch (RuntimeException e) {
            return failed(candidate, ReasonCodeClassifier.UNKNOWN, e.getMessage());
        }

        if (record == null) {
            return failed(candidate, ReasonCodeClassifier.NOT_FOUND, "quote source returned nothing");
        }
        if (record.marketCapOrZero() <= 0) {
            return failed(candidate, ReasonCodeClassifier.INVALID_QUOTE, "market cap missing or not positive");
        }
        return EnrichmentResult.success(candidate, record);
    }

    private EnrichmentResult failed(TickerCandidate candidate, String reasonCode, String message) {
        log.debug("Enrichment failed tier={} ticker={} reason={} message={}",
            FailureTier.ENRICHMENT_FAILURE, candidate.symbol(), reasonCode, message);
        return EnrichmentResult.failure(candidate, reasonCode, message);
    }
}
