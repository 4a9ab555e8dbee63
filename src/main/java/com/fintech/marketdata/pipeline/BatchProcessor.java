package com.fintech.marketdata.pipeline;

import java.util.List;

/**
 * Callback run synchronously on the consumer thread for each flushed batch.
 *
 * @param <T> event type
 */
@FunctionalInterface
public interface BatchProcessor<T> {

    /**
     * Processes events in arrival order. The list is never empty.
     */
    void process(List<T> batch);
}
