package com.fintech.marketdata.storage;

import com.fintech.marketdata.domain.Bucket;
import com.fintech.marketdata.domain.FeatureRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * No-op store used when persistence is switched off or failed to initialise.
 * Writes are discarded and reads return nothing.
 */
public final class DisabledMarketDataStore implements MarketDataStore {

    public static final DisabledMarketDataStore INSTANCE = new DisabledMarketDataStore();

    private DisabledMarketDataStore() {
    }

    @Override
    public void put(Bucket bucket, String symbol, Instant timestamp, Object record) {
    }

    @Override
    public <T> List<T> rangeScan(Bucket bucket, String symbol, Instant start, Instant end, Class<T> type) {
        return Collections.emptyList();
    }

    @Override
    public List<FeatureRecord> recentFeatures(String symbol, int limit) {
        return Collections.emptyList();
    }

    @Override
    public long deleteOlderThan(Bucket bucket, Instant cutoff) {
        return 0;
    }

    @Override
    public long count(Bucket bucket) {
        return 0;
    }

    @Override
    public boolean isHealthy() {
        return false;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void close() {
    }
}
