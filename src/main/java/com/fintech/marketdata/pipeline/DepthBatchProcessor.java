package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.decision.DecisionDispatcher;
import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.features.DepthImbalance;
import com.fintech.marketdata.features.FeatureStateRegistry;
import com.fintech.marketdata.features.SymbolFeatureState;
import com.fintech.marketdata.features.VwapAccumulator.VwapSnapshot;
import com.fintech.marketdata.storage.MarketDataStore;
import com.fintech.marketdata.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Depth path: persists the snapshot, then, once the symbol has a last price
 * and a non-zero VWAP dispersion, derives the feature set, dispatches it and
 * persists the resulting feature and price records.
 *
 * Missing preconditions are warm-up skips, not errors.
 */
public class DepthBatchProcessor implements BatchProcessor<Depth> {

    private static final Logger log = LoggerFactory.getLogger(DepthBatchProcessor.class);

    private final FeatureStateRegistry registry;
    private final DecisionDispatcher dispatcher;
    private final MarketDataStore store;
    private final PipelineMetrics metrics;

    public DepthBatchProcessor(FeatureStateRegistry registry, DecisionDispatcher dispatcher,
                               MarketDataStore store, PipelineMetrics metrics) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.store = store;
        this.metrics = metrics;
    }

    @Override
    public void process(List<Depth> batch) {
        for (Depth depth : batch) {
            processDepth(depth);
        }
    }

    void processDepth(Depth depth) {
        metrics.depthReceived();
        String symbol = depth.symbol();

        try {
            store.saveDepth(depth);
        } catch (StorageException | IllegalArgumentException e) {
            metrics.storageWriteFailed();
            log.error("Failed to persist depth: symbol={}, ts={}", symbol, depth.ts(), e);
        }

        SymbolFeatureState state = registry.get(symbol);
        if (state == null) {
            metrics.skipped(PipelineMetrics.SKIP_UNKNOWN_SYMBOL);
            log.debug("Skipping depth for unconfigured symbol: {}", symbol);
            return;
        }

        double price = registry.lastPrice(symbol).orElse(FeatureStateRegistry.NO_PRICE);
        if (price == FeatureStateRegistry.NO_PRICE) {
            metrics.skipped(PipelineMetrics.SKIP_NO_PRICE);
            return;
        }

        VwapSnapshot vwap = state.vwap().calculate();
        if (!vwap.hasDispersion()) {
            metrics.skipped(PipelineMetrics.SKIP_ZERO_DISPERSION);
            return;
        }
        metrics.vwapCalculated();

        double tickRatio = state.ticks().ratio();
        double depthRatio = DepthImbalance.ratio(depth.bidVol(), depth.askVol());

        try {
            dispatcher.attemptDecision(symbol, price, vwap.vwap(), vwap.stdDev(),
                    tickRatio, depthRatio, depth.bidVol(), depth.askVol());
            metrics.decisionDispatched();
        } catch (RuntimeException e) {
            metrics.decisionFailed();
            log.error("Decision dispatch failed: symbol={}, ts={}", symbol, depth.ts(), e);
        }

        FeatureRecord feature = FeatureRecord.of(symbol, depth.ts(), price, vwap.vwap(), vwap.stdDev(),
                tickRatio, depthRatio, depth.bidVol(), depth.askVol());

        try {
            store.saveFeature(feature);
        } catch (StorageException | IllegalArgumentException e) {
            metrics.storageWriteFailed();
            log.error("Failed to persist feature: symbol={}, ts={}", symbol, depth.ts(), e);
        }
        try {
            store.savePrice(feature.toPriceRecord());
        } catch (StorageException | IllegalArgumentException e) {
            metrics.storageWriteFailed();
            log.error("Failed to persist price: symbol={}, ts={}", symbol, depth.ts(), e);
        }

        metrics.sampleProcessed();

        if (log.isTraceEnabled()) {
            log.trace("Feature computed: {}", feature);
        }
    }
}
