package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.ingestion.EventChannel;
import com.lmax.disruptor.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the error channel: every reported stream fault is logged and
 * counted as an error and a feed reconnect.
 */
public class ErrorReporter implements EventHandler<EventChannel.Slot<Throwable>> {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final PipelineMetrics metrics;

    public ErrorReporter(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onEvent(EventChannel.Slot<Throwable> slot, long sequence, boolean endOfBatch) {
        Throwable error = slot.take();
        if (error == null) {
            return;
        }
        report(error);
    }

    void report(Throwable error) {
        log.error("Background error: {}", error.getMessage(), error);
        metrics.error();
        metrics.reconnect();
    }
}
