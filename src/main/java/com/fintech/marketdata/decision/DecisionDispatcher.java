package com.fintech.marketdata.decision;

/**
 * Hand-off to the decision subsystem (prediction, execution, risk).
 *
 * Called synchronously on the depth consumer thread once per qualifying depth
 * snapshot. Implementations should return quickly; anything they throw is
 * logged and counted by the caller and does not stop the batch.
 */
@FunctionalInterface
public interface DecisionDispatcher {

    void attemptDecision(String symbol, double price, double vwap, double stdDev,
                         double tickRatio, double depthRatio, double bidVol, double askVol);
}
