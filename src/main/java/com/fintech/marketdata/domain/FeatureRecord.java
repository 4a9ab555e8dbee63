package com.fintech.marketdata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Derived observation produced by the depth path once feature state is warm.
 * Never mutated after creation; persisted for model training and forwarded.
 *
 * @param symbol Trading pair
 * @param timestamp Observation time (the depth snapshot time)
 * @param tickRatio Mean signed tick direction over the tick window
 * @param depthRatio Bid/ask volume imbalance in [-1, 1]
 * @param priceDist Distance of price from VWAP in standard deviations
 * @param price Last traded price
 * @param vwap Volume-weighted average price
 * @param stdDev Volume-weighted standard deviation around the VWAP
 * @param bidVol Resting bid volume
 * @param askVol Resting ask volume
 */
public record FeatureRecord(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("tick_ratio") double tickRatio,
    @JsonProperty("depth_ratio") double depthRatio,
    @JsonProperty("price_dist") double priceDist,
    @JsonProperty("price") double price,
    @JsonProperty("vwap") double vwap,
    @JsonProperty("std_dev") double stdDev,
    @JsonProperty("bid_vol") double bidVol,
    @JsonProperty("ask_vol") double askVol
) {

    public FeatureRecord {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    /**
     * Builds a record from raw inputs, deriving price distance.
     * Distance is 0 when the dispersion is 0.
     */
    public static FeatureRecord of(String symbol, Instant timestamp, double price, double vwap, double stdDev,
                                   double tickRatio, double depthRatio, double bidVol, double askVol) {
        double priceDist = stdDev == 0 ? 0.0 : (price - vwap) / stdDev;
        return new FeatureRecord(symbol, timestamp, tickRatio, depthRatio, priceDist,
                price, vwap, stdDev, bidVol, askVol);
    }

    /** Returns the lighter price record used for labelling. */
    public PriceRecord toPriceRecord() {
        return new PriceRecord(symbol, timestamp, price, vwap, stdDev);
    }
}
