package com.fintech.marketdata.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Monotonic pipeline counters and the batch processing timer, registered with
 * Micrometer so they are exported through actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    public static final String SKIP_UNKNOWN_SYMBOL = "unknown_symbol";
    public static final String SKIP_NO_PRICE = "no_price";
    public static final String SKIP_ZERO_DISPERSION = "zero_dispersion";

    private final MeterRegistry registry;

    private final Counter tradesReceived;
    private final Counter depthsReceived;
    private final Counter samplesProcessed;
    private final Counter vwapCalculations;
    private final Counter decisionsDispatched;
    private final Counter decisionFailures;
    private final Counter featureErrors;
    private final Counter batchFailures;
    private final Counter storageWriteFailures;
    private final Counter errors;
    private final Counter reconnects;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.tradesReceived = registry.counter("pipeline.trades.received");
        this.depthsReceived = registry.counter("pipeline.depths.received");
        this.samplesProcessed = registry.counter("pipeline.samples.processed");
        this.vwapCalculations = registry.counter("pipeline.vwap.calculations");
        this.decisionsDispatched = registry.counter("pipeline.decisions.dispatched");
        this.decisionFailures = registry.counter("pipeline.decisions.failed");
        this.featureErrors = registry.counter("pipeline.feature.errors");
        this.batchFailures = registry.counter("pipeline.batch.failures");
        this.storageWriteFailures = registry.counter("pipeline.storage.write.failures");
        this.errors = registry.counter("pipeline.errors");
        this.reconnects = registry.counter("pipeline.feed.reconnects");
    }

    public void tradeReceived() {
        tradesReceived.increment();
    }

    public void depthReceived() {
        depthsReceived.increment();
    }

    public void sampleProcessed() {
        samplesProcessed.increment();
    }

    public void vwapCalculated() {
        vwapCalculations.increment();
    }

    public void decisionDispatched() {
        decisionsDispatched.increment();
    }

    public void decisionFailed() {
        decisionFailures.increment();
    }

    public void featureError() {
        featureErrors.increment();
    }

    public void skipped(String reason) {
        registry.counter("pipeline.events.skipped", "reason", reason).increment();
    }

    public void batchFlushed(String stream) {
        registry.counter("pipeline.batches.flushed", "stream", stream).increment();
    }

    public void batchFailed() {
        batchFailures.increment();
    }

    public void storageWriteFailed() {
        storageWriteFailures.increment();
    }

    public void error() {
        errors.increment();
    }

    public void reconnect() {
        reconnects.increment();
    }

    /** Returns the processing timer for one stream's batches. */
    public Timer batchTimer(String stream) {
        return registry.timer("pipeline.batch.processing.time", "stream", stream);
    }

    public double getTradesReceived() {
        return tradesReceived.count();
    }

    public double getDepthsReceived() {
        return depthsReceived.count();
    }

    public double getSamplesProcessed() {
        return samplesProcessed.count();
    }

    public double getVwapCalculations() {
        return vwapCalculations.count();
    }

    public double getDecisionsDispatched() {
        return decisionsDispatched.count();
    }

    public double getDecisionFailures() {
        return decisionFailures.count();
    }

    public double getFeatureErrors() {
        return featureErrors.count();
    }

    public double getSkipped(String reason) {
        return registry.counter("pipeline.events.skipped", "reason", reason).count();
    }

    public double getBatchesFlushed(String stream) {
        return registry.counter("pipeline.batches.flushed", "stream", stream).count();
    }

    public double getBatchFailures() {
        return batchFailures.count();
    }

    public double getStorageWriteFailures() {
        return storageWriteFailures.count();
    }

    public double getErrors() {
        return errors.count();
    }

    public double getReconnects() {
        return reconnects.count();
    }
}
