package com.fintech.marketdata.features;

/**
 * Order-book volume imbalance.
 */
public final class DepthImbalance {

    private DepthImbalance() {
    }

    /**
     * Returns (bid - ask) / (bid + ask), or 0 when there is no resting volume
     * or the result is not finite.
     */
    public static double ratio(double bidVol, double askVol) {
        double total = bidVol + askVol;
        if (total == 0) {
            return 0.0;
        }
        double ratio = (bidVol - askVol) / total;
        return Double.isFinite(ratio) ? ratio : 0.0;
    }
}
