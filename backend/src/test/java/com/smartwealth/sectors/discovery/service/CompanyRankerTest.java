package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import com.smartwealth.sectors.discovery.model.QuoteRecord;
import com.smartwealth.sectors.discovery.model.RetrievalStrategy;
import com.smartwealth.sectors.discovery.model.TickerCandidate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompanyRankerTest {
    private final CompanyRanker ranker = new CompanyRanker();

    @Test
    void sortsByMarketCapDescendingAndTruncates() {
        List<AcceptedCompany> accepted = List.of(
            company("AAA", 0, 100L),
            company("BBB", 1, 300L),
            company("CCC", 2, 200L)
        );

        assertThat(ranker.rank(accepted, 2))
            .extracting(c -> c.record().ticker())
            .containsExactly("BBB", "CCC");
    }

    @Test
    void tiesKeepDiscoveryOrder() {
        List<AcceptedCompany> accepted = List.of(
            company("LATE", 5, 100L),
            company("EARLY", 1, 100L),
            company("BIG", 9, 500L)
        );

        assertThat(ranker.rank(accepted, 10))
            .extracting(c -> c.record().ticker())
            .containsExactly("BIG", "EARLY", "LATE");
    }

    @Test
    void saturationFollowsLimit() {
        assertThat(ranker.isSaturated(4, 5)).isFalse();
        assertThat(ranker.isSaturated(5, 5)).isTrue();
    }

    private AcceptedCompany company(String ticker, int index, long marketCap) {
        TickerCandidate candidate = new TickerCandidate(ticker, new RetrievalStrategy.CuratedList("curated", List.of(ticker)), index);
        QuoteRecord record = new QuoteRecord(ticker, ticker, 1.0, marketCap, null, "Technology", null, null, null, null, Instant.now());
        return new AcceptedCompany(candidate, record);
    }
}
