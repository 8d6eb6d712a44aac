package com.smartwealth.sectors.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0 Safari/537.36";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int concurrency = 4;
    private int requestTimeoutSeconds = 15;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 4000;
    private Api api = new Api();
    private Collector collector = new Collector();
    private Screener screener = new Screener();
    private Enrichment enrichment = new Enrichment();
    private Quote quote = new Quote();
    private Stream stream = new Stream();
    private Catalog catalog = new Catalog();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getConcurrency() {
        return Math.max(1, concurrency);
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Collector getCollector() {
        return collector;
    }

    public void setCollector(Collector collector) {
        this.collector = collector;
    }

    public Screener getScreener() {
        return screener;
    }

    public void setScreener(Screener screener) {
        this.screener = screener;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Quote getQuote() {
        return quote;
    }

    public void setQuote(Quote quote) {
        this.quote = quote;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private int defaultLimit = 50;
        private int maxLimit = 200;

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return Math.max(getDefaultLimit(), maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }

    public static class Collector {
        private int candidateMultiplier = 3;

        public int getCandidateMultiplier() {
            return Math.max(1, candidateMultiplier);
        }

        public void setCandidateMultiplier(int candidateMultiplier) {
            this.candidateMultiplier = Math.max(1, candidateMultiplier);
        }
    }

    public static class Screener {
        private int maxSymbols = 50;

        public int getMaxSymbols() {
            return Math.max(1, maxSymbols);
        }

        public void setMaxSymbols(int maxSymbols) {
            this.maxSymbols = Math.max(1, maxSymbols);
        }
    }

    public static class Enrichment {
        private int delayMs = 100;

        public int getDelayMs() {
            return Math.max(0, delayMs);
        }

        public void setDelayMs(int delayMs) {
            this.delayMs = Math.max(0, delayMs);
        }
    }

    public static class Quote {
        private String baseUrl = "https://query2.finance.yahoo.com";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Stream {
        private int channelCapacity = 16;
        private int timeoutSeconds = 300;

        public int getChannelCapacity() {
            return Math.max(1, channelCapacity);
        }

        public void setChannelCapacity(int channelCapacity) {
            this.channelCapacity = Math.max(1, channelCapacity);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Catalog {
        private String sourcesLocation = "classpath:catalog/sector-sources.json";
        private String curatedTickersLocation = "classpath:catalog/curated-tickers.csv";

        public String getSourcesLocation() {
            return sourcesLocation;
        }

        public void setSourcesLocation(String sourcesLocation) {
            this.sourcesLocation = sourcesLocation;
        }

        public String getCuratedTickersLocation() {
            return curatedTickersLocation;
        }

        public void setCuratedTickersLocation(String curatedTickersLocation) {
            this.curatedTickersLocation = curatedTickersLocation;
        }
    }

    public static class Cli {
        private boolean run;
        private String sectors = "";
        private String subsectors = "";
        private int limit = 10;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSectors() {
            return sectors;
        }

        public void setSectors(String sectors) {
            this.sectors = sectors;
        }

        public String getSubsectors() {
            return subsectors;
        }

        public void setSubsectors(String subsectors) {
            this.subsectors = subsectors;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
