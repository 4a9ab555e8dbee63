package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.Trade;

/**
 * Receiving end of the event channels, as seen by a feed adapter.
 *
 * Publishing blocks while the target channel is full. Both publish methods
 * return false once the pipeline is shutting down or the calling thread is
 * interrupted; the event is then not delivered.
 */
public interface MarketEventSink {

    boolean onTrade(Trade trade);

    boolean onDepth(Depth depth);

    /**
     * Reports a transient stream fault (parse error, dropped connection).
     * Never blocks; if the error channel is full the report is logged and dropped.
     */
    void onError(Throwable error);
}
