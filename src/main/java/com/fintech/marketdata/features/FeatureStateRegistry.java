package com.fintech.marketdata.features;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Symbol-keyed feature state shared by the trade and depth consumers.
 *
 * The symbol set is fixed at construction: accumulators are created once and
 * never replaced, and unknown symbols never create state. Last prices live in
 * a concurrent map initialised to the sentinel 0 for every configured symbol.
 */
public class FeatureStateRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeatureStateRegistry.class);

    public static final double NO_PRICE = 0.0;

    private final Map<String, SymbolFeatureState> states;
    private final ConcurrentHashMap<String, Double> lastPrices;

    public FeatureStateRegistry(Collection<String> symbols, Duration vwapWindow, int vwapSize, int tickSize) {
        this(symbols, vwapWindow, vwapSize, tickSize, System::nanoTime);
    }

    public FeatureStateRegistry(Collection<String> symbols, Duration vwapWindow, int vwapSize, int tickSize,
                                LongSupplier nanoClock) {
        Map<String, SymbolFeatureState> created = new LinkedHashMap<>();
        this.lastPrices = new ConcurrentHashMap<>();
        for (String symbol : symbols) {
            created.put(symbol, new SymbolFeatureState(
                symbol,
                new VwapAccumulator(vwapWindow, vwapSize, nanoClock),
                new TickImbalanceAccumulator(tickSize)));
            lastPrices.put(symbol, NO_PRICE);
        }
        this.states = Map.copyOf(created);

        log.info("Feature state initialised: symbols={}, vwapWindow={}, vwapSize={}, tickSize={}",
                created.keySet(), vwapWindow, vwapSize, tickSize);
    }

    /** Returns the state for a configured symbol, or null if the symbol is unknown. */
    public SymbolFeatureState get(String symbol) {
        return states.get(symbol);
    }

    public boolean isConfigured(String symbol) {
        return states.containsKey(symbol);
    }

    public Set<String> symbols() {
        return states.keySet();
    }

    /**
     * Returns the last observed price, {@link #NO_PRICE} before the first trade,
     * or empty for an unknown symbol.
     */
    public OptionalDouble lastPrice(String symbol) {
        Double price = lastPrices.get(symbol);
        return price != null ? OptionalDouble.of(price) : OptionalDouble.empty();
    }

    /**
     * Stores a new last price for a configured symbol.
     *
     * @return the previous price, or empty if the symbol is unknown (nothing stored)
     */
    public OptionalDouble updateLastPrice(String symbol, double price) {
        if (!states.containsKey(symbol)) {
            return OptionalDouble.empty();
        }
        Double previous = lastPrices.put(symbol, price);
        return OptionalDouble.of(previous != null ? previous : NO_PRICE);
    }
}
