package com.fintech.marketdata.features;

import java.time.Duration;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * Rolling volume-weighted average price over a bounded sample window.
 *
 * Samples are kept in a fixed-size ring and additionally expire once they are
 * older than the configured time window. Writes come from the trade consumer,
 * reads from the depth consumer; a read/write lock keeps the two consistent.
 */
public class VwapAccumulator {

    private final long windowNanos;
    private final int capacity;
    private final LongSupplier nanoClock;

    private final double[] prices;
    private final double[] quantities;
    private final long[] arrivals;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private int head;
    private int size;

    public VwapAccumulator(Duration window, int capacity) {
        this(window, capacity, System::nanoTime);
    }

    public VwapAccumulator(Duration window, int capacity, LongSupplier nanoClock) {
        if (capacity <= 0) {
            capacity = 1;
        }
        if (window == null || window.isZero() || window.isNegative()) {
            window = Duration.ofMinutes(1);
        }
        this.windowNanos = window.toNanos();
        this.capacity = capacity;
        this.nanoClock = nanoClock;
        this.prices = new double[capacity];
        this.quantities = new double[capacity];
        this.arrivals = new long[capacity];
    }

    /**
     * Adds a price/quantity sample, overwriting the oldest one when full.
     *
     * @return false if the sample was rejected (NaN, infinite or negative)
     */
    public boolean add(double price, double qty) {
        if (!isValid(price) || !isValid(qty)) {
            return false;
        }

        long now = nanoClock.getAsLong();
        lock.writeLock().lock();
        try {
            prices[head] = price;
            quantities[head] = qty;
            arrivals[head] = now;
            head = (head + 1) % capacity;
            if (size < capacity) {
                size++;
            }
        } finally {
            lock.writeLock().unlock();
        }
        return true;
    }

    /**
     * Computes VWAP and volume-weighted standard deviation over in-window samples.
     * Returns {@link VwapSnapshot#EMPTY} when there is no volume; dispersion is 0
     * for a single sample and collapses to 0 if it is not finite.
     */
    public VwapSnapshot calculate() {
        long cutoff = nanoClock.getAsLong() - windowNanos;

        lock.readLock().lock();
        try {
            if (size == 0) {
                return VwapSnapshot.EMPTY;
            }

            double pv = 0.0;
            double vv = 0.0;
            int count = 0;
            int start = (head - size + capacity) % capacity;
            for (int i = 0; i < size; i++) {
                int idx = (start + i) % capacity;
                if (arrivals[idx] - cutoff > 0) {
                    pv += prices[idx] * quantities[idx];
                    vv += quantities[idx];
                    count++;
                }
            }

            if (vv == 0 || count == 0) {
                return VwapSnapshot.EMPTY;
            }

            double vwap = pv / vv;
            if (!Double.isFinite(vwap)) {
                return VwapSnapshot.EMPTY;
            }
            if (count == 1) {
                return new VwapSnapshot(vwap, 0.0, 1);
            }

            double weightedVariance = 0.0;
            for (int i = 0; i < size; i++) {
                int idx = (start + i) % capacity;
                if (arrivals[idx] - cutoff > 0) {
                    double deviation = prices[idx] - vwap;
                    weightedVariance += quantities[idx] * deviation * deviation;
                }
            }

            double variance = weightedVariance / vv;
            double stdDev = variance > 0 ? Math.sqrt(variance) : 0.0;
            if (!Double.isFinite(stdDev)) {
                stdDev = 0.0;
            }
            return new VwapSnapshot(vwap, stdDev, count);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the number of samples currently held (in or out of the time window). */
    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Clears all samples. */
    public void reset() {
        lock.writeLock().lock();
        try {
            head = 0;
            size = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean isValid(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    /**
     * Result of a VWAP calculation.
     *
     * @param vwap Volume-weighted average price
     * @param stdDev Volume-weighted standard deviation
     * @param sampleCount Samples that contributed
     */
    public record VwapSnapshot(double vwap, double stdDev, int sampleCount) {

        public static final VwapSnapshot EMPTY = new VwapSnapshot(0.0, 0.0, 0);

        /** Returns true when the dispersion carries signal. */
        public boolean hasDispersion() {
            return stdDev != 0.0;
        }
    }
}
