package com.smartwealth.sectors.discovery.source;

import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.http.PoliteHttpClient;
import com.smartwealth.sectors.discovery.http.SourceFetchException;
import com.smartwealth.sectors.discovery.model.HttpFetchResult;
import com.smartwealth.sectors.discovery.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class YahooScreenerScrapeClient implements ScreenerScrapeSource {
    private static final Logger log = LoggerFactory.getLogger(YahooScreenerScrapeClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final int MAX_RAW_SYMBOL_LENGTH = 5;

    private final PoliteHttpClient httpClient;
    private final DiscoveryProperties properties;

    public YahooScreenerScrapeClient(PoliteHttpClient httpClient, DiscoveryProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public List<String> fetchSymbols(String screenerUrl) {
        HttpFetchResult fetch = httpClient.get(screenerUrl, HTML_ACCEPT);
        if (!fetch.isSuccessful()) {
            String reason = ReasonCodeClassifier.fromFetchResult(fetch);
            String detail = fetch.errorCode() == null ? "http_" + fetch.statusCode() : fetch.errorCode();
            throw new SourceFetchException(reason, "screener fetch failed: " + detail);
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            throw new SourceFetchException(ReasonCodeClassifier.EMPTY_RESULT, "screener page was empty");
        }

        Document document = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
        List<String> symbols = extractSymbols(document, properties.getScreener().getMaxSymbols());
        if (symbols.isEmpty()) {
            throw new SourceFetchException(ReasonCodeClassifier.EMPTY_RESULT, "no symbols found on screener page");
        }
        log.debug("Screener {} listed {} symbols", screenerUrl, symbols.size());
        return symbols;
    }

    /** Tries the result table first, then quote links, then data-symbol attributes; the first non-empty wins. */
    static List<String> extractSymbols(Document document, int maxSymbols) {
        List<String> symbols = fromTableRows(document, maxSymbols);
        if (symbols.isEmpty()) {
            symbols = fromQuoteLinks(document, maxSymbols);
        }
        if (symbols.isEmpty()) {
            symbols = fromDataSymbolAttributes(document, maxSymbols);
        }
        return symbols;
    }

    private static List<String> fromTableRows(Document document, int maxSymbols) {
        Set<String> symbols = new LinkedHashSet<>();
        for (Element row : document.select("tr.simpTblRow")) {
            Element firstCell = row.selectFirst("td");
            Element link = firstCell == null ? null : firstCell.selectFirst("a");
            if (link != null) {
                addSymbol(symbols, link.text(), maxSymbols);
            }
        }
        return new ArrayList<>(symbols);
    }

    private static List<String> fromQuoteLinks(Document document, int maxSymbols) {
        Set<String> symbols = new LinkedHashSet<>();
        for (Element link : document.select("a[href*=/quote/]")) {
            String href = link.attr("href");
            int idx = href.indexOf("/quote/");
            String tail = href.substring(idx + "/quote/".length());
            int end = 0;
            while (end < tail.length() && tail.charAt(end) != '/' && tail.charAt(end) != '?') {
                end++;
            }
            addSymbol(symbols, tail.substring(0, end), maxSymbols);
        }
        return new ArrayList<>(symbols);
    }

    private static List<String> fromDataSymbolAttributes(Document document, int maxSymbols) {
        Set<String> symbols = new LinkedHashSet<>();
        for (Element element : document.select("[data-symbol]")) {
            addSymbol(symbols, element.attr("data-symbol"), maxSymbols);
        }
        return new ArrayList<>(symbols);
    }

    private static void addSymbol(Set<String> symbols, String raw, int maxSymbols) {
        if (symbols.size() >= maxSymbols || raw == null) {
            return;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty() || value.length() > MAX_RAW_SYMBOL_LENGTH) {
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isLetter(value.charAt(i))) {
                return;
            }
        }
        symbols.add(value);
    }
}
