package com.fintech.marketdata.features;

/**
 * Accumulators owned by one configured symbol for the process lifetime.
 */
public record SymbolFeatureState(
    String symbol,
    VwapAccumulator vwap,
    TickImbalanceAccumulator ticks
) {
}
