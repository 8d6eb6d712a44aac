package com.smartwealth.sectors.discovery.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CompanyView(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("name") String name,
    @JsonProperty("current_price") Double currentPrice,
    @JsonProperty("price_change_pct") Double priceChangePct,
    @JsonProperty("market_cap") Long marketCap,
    @JsonProperty("pe_ratio") Double peRatio,
    @JsonProperty("sector") String sector,
    @JsonProperty("industry") String industry,
    @JsonProperty("volume") Long volume,
    @JsonProperty("avg_volume") Long avgVolume
) {
    public static CompanyView from(QuoteRecord record) {
        return new CompanyView(
            record.ticker(),
            record.name(),
            record.price(),
            record.priceChangePct(),
            record.marketCap(),
            record.peRatio(),
            record.sector(),
            record.industry(),
            record.volume(),
            record.avgVolume()
        );
    }
}
