package com.fintech.marketdata.decision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default dispatcher when no decision subsystem is wired in: logs each
 * observation at debug level and counts it.
 */
public class LoggingDecisionDispatcher implements DecisionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingDecisionDispatcher.class);

    private final AtomicLong observations = new AtomicLong(0);

    @Override
    public void attemptDecision(String symbol, double price, double vwap, double stdDev,
                                double tickRatio, double depthRatio, double bidVol, double askVol) {
        long n = observations.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("Observation #{}: symbol={}, price={}, vwap={}, stdDev={}, tickRatio={}, depthRatio={}, bidVol={}, askVol={}",
                    n, symbol, price, vwap, stdDev, tickRatio, depthRatio, bidVol, askVol);
        }
    }

    public long getObservations() {
        return observations.get();
    }
}
