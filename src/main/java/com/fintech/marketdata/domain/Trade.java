package com.fintech.marketdata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable executed transaction from the exchange feed.
 *
 * @param symbol Trading pair (e.g., "BTCUSDT")
 * @param price Execution price
 * @param qty Executed quantity
 * @param ts Execution time (nanosecond precision)
 */
public record Trade(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("price") double price,
    @JsonProperty("qty") double qty,
    @JsonProperty("ts") Instant ts
) {

    public Trade {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(ts, "Timestamp cannot be null");
    }
}
