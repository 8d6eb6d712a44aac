package com.smartwealth.sectors.discovery.source;

import java.util.List;

public interface ScreenerScrapeSource {
    /**
     * Raw symbols listed by a screener page, in page order.
     *
     * @throws com.smartwealth.sectors.discovery.http.SourceFetchException when the page cannot be fetched or lists nothing
     */
    List<String> fetchSymbols(String screenerUrl);
}
