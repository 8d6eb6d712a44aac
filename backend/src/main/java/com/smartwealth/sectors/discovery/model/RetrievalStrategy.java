package com.smartwealth.sectors.discovery.model;

import java.util.List;

/**
 * One way of obtaining candidate ticker symbols for a sector or subsector.
 */
public sealed interface RetrievalStrategy
    permits RetrievalStrategy.ScreenerScrape, RetrievalStrategy.CuratedList, RetrievalStrategy.StaticFallback {

    /** Stable identifier used for provenance and per-strategy counts. */
    String label();

    /** Static tables only run when nothing earlier in the same chain produced a symbol. */
    default boolean fallbackOnly() {
        return false;
    }

    record ScreenerScrape(String url) implements RetrievalStrategy {
        @Override
        public String label() {
            return "screener:" + url;
        }
    }

    record CuratedList(String providerId, List<String> tickers) implements RetrievalStrategy {
        public CuratedList {
            tickers = tickers == null ? List.of() : List.copyOf(tickers);
        }

        @Override
        public String label() {
            return "curated:" + providerId;
        }
    }

    record StaticFallback(String sectorName, List<String> tickers) implements RetrievalStrategy {
        public StaticFallback {
            tickers = tickers == null ? List.of() : List.copyOf(tickers);
        }

        @Override
        public String label() {
            return "fallback:" + sectorName;
        }

        @Override
        public boolean fallbackOnly() {
            return true;
        }
    }
}
