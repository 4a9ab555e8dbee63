package com.fintech.marketdata.features;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling window of signed trade directions (+1 uptick, -1 downtick, 0 flat).
 * Thread-safe; written by the trade consumer and read by the depth consumer.
 */
public class TickImbalanceAccumulator {

    private final int capacity;
    private final Deque<Integer> signs;
    private int sum;

    public TickImbalanceAccumulator(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.signs = new ArrayDeque<>(this.capacity);
    }

    /**
     * Returns the tick sign for a price move: +1 if strictly greater, -1 if
     * strictly less, 0 if equal.
     */
    public static int sign(double newPrice, double previousPrice) {
        if (newPrice > previousPrice) {
            return 1;
        }
        if (newPrice < previousPrice) {
            return -1;
        }
        return 0;
    }

    /** Appends a sign, evicting the oldest one once the window is full. */
    public synchronized void add(int sign) {
        if (sign < -1 || sign > 1) {
            throw new IllegalArgumentException("Tick sign must be -1, 0 or 1: " + sign);
        }
        if (signs.size() == capacity) {
            sum -= signs.removeFirst();
        }
        signs.addLast(sign);
        sum += sign;
    }

    /** Returns the mean sign over the window, 0 when empty. */
    public synchronized double ratio() {
        if (signs.isEmpty()) {
            return 0.0;
        }
        return (double) sum / signs.size();
    }

    /** Returns the most recently appended sign, or 0 when empty. */
    public synchronized int lastSign() {
        Integer last = signs.peekLast();
        return last != null ? last : 0;
    }

    public synchronized int size() {
        return signs.size();
    }
}
