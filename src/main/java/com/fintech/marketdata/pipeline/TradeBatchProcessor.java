package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.features.FeatureStateRegistry;
import com.fintech.marketdata.features.SymbolFeatureState;
import com.fintech.marketdata.features.TickImbalanceAccumulator;
import com.fintech.marketdata.storage.MarketDataStore;
import com.fintech.marketdata.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Trade path: persists the raw trade, then feeds the VWAP and tick
 * accumulators and advances the last price of configured symbols.
 */
public class TradeBatchProcessor implements BatchProcessor<Trade> {

    private static final Logger log = LoggerFactory.getLogger(TradeBatchProcessor.class);

    private final FeatureStateRegistry registry;
    private final MarketDataStore store;
    private final PipelineMetrics metrics;

    public TradeBatchProcessor(FeatureStateRegistry registry, MarketDataStore store, PipelineMetrics metrics) {
        this.registry = registry;
        this.store = store;
        this.metrics = metrics;
    }

    @Override
    public void process(List<Trade> batch) {
        for (Trade trade : batch) {
            processTrade(trade);
        }
    }

    void processTrade(Trade trade) {
        metrics.tradeReceived();

        try {
            store.saveTrade(trade);
        } catch (StorageException | IllegalArgumentException e) {
            metrics.storageWriteFailed();
            log.error("Failed to persist trade: symbol={}, ts={}", trade.symbol(), trade.ts(), e);
        }

        SymbolFeatureState state = registry.get(trade.symbol());
        if (state == null) {
            metrics.skipped(PipelineMetrics.SKIP_UNKNOWN_SYMBOL);
            log.debug("Skipping trade for unconfigured symbol: {}", trade.symbol());
            return;
        }

        if (!state.vwap().add(trade.price(), trade.qty())) {
            metrics.featureError();
            log.warn("Rejected VWAP sample: symbol={}, price={}, qty={}", trade.symbol(), trade.price(), trade.qty());
        }

        // Last price is only written from the trade consumer thread
        double previous = registry.lastPrice(trade.symbol()).orElse(FeatureStateRegistry.NO_PRICE);
        state.ticks().add(TickImbalanceAccumulator.sign(trade.price(), previous));
        registry.updateLastPrice(trade.symbol(), trade.price());

        metrics.sampleProcessed();
    }
}
