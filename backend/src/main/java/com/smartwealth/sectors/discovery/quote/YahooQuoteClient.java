package com.smartwealth.sectors.discovery.quote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartwealth.sectors.config.DiscoveryProperties;
import com.smartwealth.sectors.discovery.http.PoliteHttpClient;
import com.smartwealth.sectors.discovery.http.SourceFetchException;
import com.smartwealth.sectors.discovery.model.HttpFetchResult;
import com.smartwealth.sectors.discovery.model.QuoteRecord;
import com.smartwealth.sectors.discovery.util.ReasonCodeClassifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Quote lookups against the Yahoo Finance quoteSummary endpoint.
 */
@Service
public class YahooQuoteClient implements QuoteSource {
    private static final String MODULES = "price,summaryDetail,assetProfile";
    private static final String JSON_ACCEPT = "application/json,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    public YahooQuoteClient(PoliteHttpClient httpClient, ObjectMapper objectMapper, DiscoveryProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public QuoteRecord getQuote(String ticker) {
        String url = quoteUrl(ticker);
        HttpFetchResult fetch = httpClient.get(url, JSON_ACCEPT);
        if (fetch.statusCode() == 404) {
            throw new SourceFetchException(ReasonCodeClassifier.NOT_FOUND, "no quote for " + ticker);
        }
        if (!fetch.isSuccessful()) {
            String detail = fetch.errorCode() == null ? "http_" + fetch.statusCode() : fetch.errorCode();
            throw new SourceFetchException(ReasonCodeClassifier.fromFetchResult(fetch), "quote fetch failed for " + ticker + ": " + detail);
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, "empty quote payload for " + ticker);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (IOException e) {
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, "malformed quote payload for " + ticker, e);
        }
        JsonNode summary = root.path("quoteSummary");
        JsonNode error = summary.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new SourceFetchException(ReasonCodeClassifier.NOT_FOUND, error.path("description").asText("quote error for " + ticker));
        }
        JsonNode results = summary.path("result");
        if (!results.isArray() || results.isEmpty()) {
            throw new SourceFetchException(ReasonCodeClassifier.NOT_FOUND, "no quote result for " + ticker);
        }
        return toRecord(ticker, results.get(0));
    }

    private QuoteRecord toRecord(String ticker, JsonNode result) {
        JsonNode price = result.path("price");
        JsonNode detail = result.path("summaryDetail");
        JsonNode profile = result.path("assetProfile");

        String name = text(price.path("longName"));
        if (name == null) {
            name = text(price.path("shortName"));
        }
        Double changeFraction = rawDouble(price.path("regularMarketChangePercent"));
        Double peRatio = rawDouble(detail.path("trailingPE"));
        Long avgVolume = rawLong(detail.path("averageVolume"));
        Long marketCap = rawLong(price.path("marketCap"));
        if (marketCap == null) {
            marketCap = rawLong(detail.path("marketCap"));
        }
        return new QuoteRecord(
            ticker,
            name == null ? ticker : name,
            rawDouble(price.path("regularMarketPrice")),
            marketCap,
            peRatio,
            text(profile.path("sector")),
            text(profile.path("industry")),
            rawLong(price.path("regularMarketVolume")),
            avgVolume,
            changeFraction == null ? null : changeFraction * 100.0,
            Instant.now()
        );
    }

    private String quoteUrl(String ticker) {
        String baseUrl = properties.getQuote().getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/v10/finance/quoteSummary/"
            + URLEncoder.encode(ticker, StandardCharsets.UTF_8)
            + "?modules=" + URLEncoder.encode(MODULES, StandardCharsets.UTF_8);
    }

    // Yahoo wraps numbers as {"raw": 1.23, "fmt": "1.23"}; older payloads carry the bare number.
    private Double rawDouble(JsonNode node) {
        JsonNode value = node.has("raw") ? node.get("raw") : node;
        return value.isNumber() ? value.asDouble() : null;
    }

    private Long rawLong(JsonNode node) {
        JsonNode value = node.has("raw") ? node.get("raw") : node;
        return value.isNumber() ? value.asLong() : null;
    }

    private String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
