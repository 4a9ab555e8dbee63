package com.fintech.marketdata.ingestion;

import java.util.Collection;

/**
 * Exchange feed adapter. Wire protocol, subscription and reconnection are the
 * adapter's business; the pipeline only sees decoded events.
 */
public interface MarketFeed {

    /**
     * Streams events for the given symbols into the sink until interrupted.
     *
     * @throws InterruptedException when the pipeline cancels the feed thread
     * @throws RuntimeException on a fatal fault; the pipeline reports it to the error channel
     */
    void stream(Collection<String> symbols, MarketEventSink sink) throws InterruptedException;

    /** Returns a short name for logging. */
    default String name() {
        return getClass().getSimpleName();
    }
}
