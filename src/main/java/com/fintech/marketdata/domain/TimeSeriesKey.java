package com.fintech.marketdata.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Composite key for a record in the time-series store.
 * Implements natural ordering by symbol, then time.
 *
 * The string form is {@code SYMBOL_NNNNNNNNNNNNNNNNNNN}: the symbol, a separator
 * and the epoch-nanosecond timestamp zero-padded to 19 digits, so that plain
 * string comparison of two keys for the same symbol equals chronological order.
 */
public record TimeSeriesKey(
    String symbol,
    long epochNanos
) implements Comparable<TimeSeriesKey> {

    public static final char SEPARATOR = '_';

    public static final int TIMESTAMP_WIDTH = 19;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    public TimeSeriesKey {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("Symbol cannot be empty");
        }
        if (epochNanos < 0) {
            throw new IllegalArgumentException("Timestamp before epoch: " + epochNanos);
        }
    }

    /**
     * Creates a key for a stored record.
     *
     * @throws IllegalArgumentException if the instant is before the epoch or beyond year 2262
     */
    public static TimeSeriesKey of(String symbol, Instant timestamp) {
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        try {
            long nanos = Math.addExact(
                Math.multiplyExact(timestamp.getEpochSecond(), NANOS_PER_SECOND),
                timestamp.getNano());
            return new TimeSeriesKey(symbol, nanos);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Timestamp not representable in epoch nanos: " + timestamp, e);
        }
    }

    /**
     * Creates a scan bound. Instants outside the representable range are clamped
     * to 0 or {@link Long#MAX_VALUE} instead of failing.
     */
    public static TimeSeriesKey bound(String symbol, Instant timestamp) {
        return new TimeSeriesKey(symbol, clampToEpochNanos(timestamp));
    }

    /** Converts an instant to epoch nanos, clamping to [0, Long.MAX_VALUE]. */
    public static long clampToEpochNanos(Instant timestamp) {
        if (timestamp.getEpochSecond() < 0) {
            return 0L;
        }
        try {
            return Math.addExact(
                Math.multiplyExact(timestamp.getEpochSecond(), NANOS_PER_SECOND),
                timestamp.getNano());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /** Returns the key prefix shared by every record of a symbol. */
    public static String prefix(String symbol) {
        return symbol + SEPARATOR;
    }

    /**
     * Compares keys for natural ordering.
     * Order: symbol (asc) -> time (asc)
     */
    @Override
    public int compareTo(TimeSeriesKey other) {
        int symbolCompare = this.symbol.compareTo(other.symbol);
        if (symbolCompare != 0) {
            return symbolCompare;
        }
        return Long.compare(this.epochNanos, other.epochNanos);
    }

    /** Returns the timestamp as an {@link Instant}. */
    public Instant toInstant() {
        return Instant.ofEpochSecond(epochNanos / NANOS_PER_SECOND, epochNanos % NANOS_PER_SECOND);
    }

    /**
     * Creates the string representation used as the storage key.
     * Format: "SYMBOL_0001700000000000000000"
     */
    public String toStringKey() {
        StringBuilder sb = new StringBuilder(symbol.length() + 1 + TIMESTAMP_WIDTH);
        sb.append(symbol).append(SEPARATOR);
        String digits = Long.toString(epochNanos);
        for (int i = digits.length(); i < TIMESTAMP_WIDTH; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }

    /**
     * Parses a string key back into a TimeSeriesKey.
     * The symbol may itself contain the separator; the timestamp is always the
     * trailing fixed-width segment.
     *
     * @throws IllegalArgumentException if the format is invalid
     */
    public static TimeSeriesKey fromStringKey(String stringKey) {
        int separatorIndex = stringKey.length() - TIMESTAMP_WIDTH - 1;
        if (separatorIndex < 1 || stringKey.charAt(separatorIndex) != SEPARATOR) {
            throw new IllegalArgumentException("Invalid key format: " + stringKey);
        }
        String digits = stringKey.substring(separatorIndex + 1);
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Invalid key timestamp: " + stringKey);
            }
        }
        return new TimeSeriesKey(stringKey.substring(0, separatorIndex), Long.parseLong(digits));
    }
}
