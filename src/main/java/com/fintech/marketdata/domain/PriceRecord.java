package com.fintech.marketdata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Price snapshot kept for downstream labelling of feature records.
 */
public record PriceRecord(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("price") double price,
    @JsonProperty("vwap") double vwap,
    @JsonProperty("std_dev") double stdDev
) {

    public PriceRecord {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }
}
