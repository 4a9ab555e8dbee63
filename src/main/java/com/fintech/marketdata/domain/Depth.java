package com.fintech.marketdata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable order-book volume snapshot.
 *
 * @param symbol Trading pair
 * @param bidVol Total resting bid volume
 * @param askVol Total resting ask volume
 * @param lastPrice Last traded price reported with the snapshot
 * @param ts Snapshot time
 */
public record Depth(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("bid_vol") double bidVol,
    @JsonProperty("ask_vol") double askVol,
    @JsonProperty("last_price") double lastPrice,
    @JsonProperty("ts") Instant ts
) {

    public Depth {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(ts, "Timestamp cannot be null");
    }

    /** Returns bid + ask resting volume. */
    public double totalVolume() {
        return bidVol + askVol;
    }
}
