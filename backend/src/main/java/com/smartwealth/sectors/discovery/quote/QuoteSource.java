package com.smartwealth.sectors.discovery.quote;

import com.smartwealth.sectors.discovery.model.QuoteRecord;

public interface QuoteSource {
    /**
     * Live quote for one ticker. Never cached.
     *
     * @throws com.smartwealth.sectors.discovery.http.SourceFetchException when no usable quote is available
     */
    QuoteRecord getQuote(String ticker);
}
