package com.fintech.marketdata.storage;

import com.fintech.marketdata.domain.Bucket;
import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.domain.PriceRecord;
import com.fintech.marketdata.domain.Trade;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only time-series store for market events and derived records.
 *
 * Records are grouped into {@link Bucket}s and keyed by symbol + timestamp.
 * Implementations must allow concurrent writers and readers; each write is
 * atomic and scans never observe a partially written record.
 */
public interface MarketDataStore extends AutoCloseable {

    /**
     * Persists one record. The bucket is created lazily on first write.
     * A record written at the same symbol and timestamp replaces the previous one.
     *
     * @throws StorageException if serialization or the engine write fails
     * @throws IllegalArgumentException if the timestamp is before the epoch
     */
    void put(Bucket bucket, String symbol, Instant timestamp, Object record);

    /**
     * Returns records of a symbol with start &lt;= key time &lt;= end, ascending.
     * A bucket that was never written yields an empty list. Records that fail
     * to decode are skipped.
     */
    <T> List<T> rangeScan(Bucket bucket, String symbol, Instant start, Instant end, Class<T> type);

    /**
     * Returns the newest {@code limit} features of a symbol in ascending time order.
     */
    List<FeatureRecord> recentFeatures(String symbol, int limit);

    /**
     * Deletes records strictly older than the cutoff.
     *
     * @return number of records removed
     */
    long deleteOlderThan(Bucket bucket, Instant cutoff);

    /** Returns the number of records held in a bucket. */
    long count(Bucket bucket);

    /** Returns true if reads and writes are currently served. */
    boolean isHealthy();

    /** Returns false for the no-op store used when persistence is unavailable. */
    boolean isEnabled();

    /** Releases the engine and the directory lock. Idempotent. */
    @Override
    void close();

    default void saveTrade(Trade trade) {
        put(Bucket.TRADES, trade.symbol(), trade.ts(), trade);
    }

    default void saveDepth(Depth depth) {
        put(Bucket.DEPTHS, depth.symbol(), depth.ts(), depth);
    }

    default void saveFeature(FeatureRecord feature) {
        put(Bucket.FEATURES, feature.symbol(), feature.timestamp(), feature);
    }

    default void savePrice(PriceRecord price) {
        put(Bucket.PRICES, price.symbol(), price.timestamp(), price);
    }

    default List<Trade> getTrades(String symbol, Instant start, Instant end) {
        return rangeScan(Bucket.TRADES, symbol, start, end, Trade.class);
    }

    default List<Depth> getDepths(String symbol, Instant start, Instant end) {
        return rangeScan(Bucket.DEPTHS, symbol, start, end, Depth.class);
    }

    default List<PriceRecord> getPrices(String symbol, Instant start, Instant end) {
        return rangeScan(Bucket.PRICES, symbol, start, end, PriceRecord.class);
    }

    /**
     * Returns features with start &lt; timestamp &lt; end. Unlike the other
     * buckets both bounds are exclusive.
     */
    default List<FeatureRecord> getFeatures(String symbol, Instant start, Instant end) {
        return rangeScan(Bucket.FEATURES, symbol, start, end, FeatureRecord.class).stream()
            .filter(f -> f.timestamp().isAfter(start) && f.timestamp().isBefore(end))
            .collect(Collectors.toList());
    }
}
