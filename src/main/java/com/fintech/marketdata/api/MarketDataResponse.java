package com.fintech.marketdata.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Envelope for range queries: the bucket and symbol queried plus the
 * matching records in ascending time order.
 */
@Schema(description = "Records from one bucket for one symbol, oldest first")
public record MarketDataResponse<T>(
    @Schema(description = "Bucket queried", example = "trades")
    String bucket,

    @Schema(description = "Trading symbol", example = "BTCUSDT")
    String symbol,

    @Schema(description = "Number of records returned", example = "2")
    int count,

    @Schema(description = "Records in ascending time order")
    List<T> records
) {

    public static <T> MarketDataResponse<T> of(String bucket, String symbol, List<T> records) {
        return new MarketDataResponse<>(bucket, symbol, records.size(), records);
    }
}
