package com.fintech.marketdata.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketdata.domain.Bucket;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.domain.TimeSeriesKey;
import net.openhft.chronicle.map.ChronicleMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chronicle Map implementation of MarketDataStore.
 *
 * Records are held as JSON in a single off-heap, memory-mapped map persisted
 * to disk and recovered on restart. Storage keys are
 * {@code <bucket>:<SYMBOL>_<19-digit epoch nanos>}.
 *
 * Chronicle Map has no ordering, so each bucket keeps an in-memory sorted
 * index of its keys. The index is rebuilt from the map on open and updated
 * after each successful write, so a key is only visible to scans once its
 * value is in the map.
 *
 * Thread-safe for concurrent access.
 */
public class ChronicleMapMarketDataStore implements MarketDataStore {

    private static final Logger log = LoggerFactory.getLogger(ChronicleMapMarketDataStore.class);

    static final char BUCKET_SEPARATOR = ':';

    private final ChronicleMap<String, String> map;
    private final ObjectMapper objectMapper;
    private final FileChannel lockChannel;
    private final FileLock lock;

    private final ConcurrentMap<Bucket, NavigableSet<String>> indexes = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong writeCounter = new AtomicLong(0);
    private final AtomicLong readCounter = new AtomicLong(0);
    private final AtomicLong decodeFailures = new AtomicLong(0);

    ChronicleMapMarketDataStore(ChronicleMap<String, String> map, ObjectMapper objectMapper,
                                FileChannel lockChannel, FileLock lock) {
        this.map = map;
        this.objectMapper = objectMapper;
        this.lockChannel = lockChannel;
        this.lock = lock;
        rebuildIndexes();
    }

    private void rebuildIndexes() {
        Map<Bucket, Long> loaded = new EnumMap<>(Bucket.class);
        for (String storageKey : map.keySet()) {
            int separator = storageKey.indexOf(BUCKET_SEPARATOR);
            if (separator <= 0) {
                log.warn("Ignoring storage key without bucket: {}", storageKey);
                continue;
            }
            Bucket bucket;
            try {
                bucket = Bucket.fromName(storageKey.substring(0, separator));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring storage key with unknown bucket: {}", storageKey);
                continue;
            }
            indexFor(bucket).add(storageKey.substring(separator + 1));
            loaded.merge(bucket, 1L, Long::sum);
        }
        log.info("Chronicle Map indexes rebuilt: existing_entries={}, per_bucket={}", map.size(), loaded);
    }

    @Override
    public void put(Bucket bucket, String symbol, Instant timestamp, Object record) {
        ensureOpen();
        String key = TimeSeriesKey.of(symbol, timestamp).toStringKey();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + bucket.bucketName() + " record for key " + key, e);
        }

        try {
            map.put(storageKey(bucket, key), payload);
        } catch (RuntimeException e) {
            throw new StorageException("Write failed for " + bucket.bucketName() + " key " + key, e);
        }
        indexFor(bucket).add(key);
        writeCounter.incrementAndGet();

        if (log.isTraceEnabled()) {
            log.trace("Saved record: bucket={}, key={}", bucket.bucketName(), key);
        }
    }

    @Override
    public <T> List<T> rangeScan(Bucket bucket, String symbol, Instant start, Instant end, Class<T> type) {
        ensureOpen();
        readCounter.incrementAndGet();

        NavigableSet<String> index = indexes.get(bucket);
        if (index == null) {
            return Collections.emptyList();
        }

        // A pre-epoch end must not clamp onto records stored at the epoch
        if (end.isBefore(Instant.EPOCH)) {
            return Collections.emptyList();
        }

        String startKey = TimeSeriesKey.bound(symbol, start).toStringKey();
        String endKey = TimeSeriesKey.bound(symbol, end).toStringKey();
        if (startKey.compareTo(endKey) > 0) {
            return Collections.emptyList();
        }

        List<T> results = new ArrayList<>();
        for (String key : index.subSet(startKey, true, endKey, true)) {
            T record = read(bucket, symbol, key, type);
            if (record != null) {
                results.add(record);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Range scan: bucket={}, symbol={}, from={}, to={}, results={}",
                    bucket.bucketName(), symbol, start, end, results.size());
        }
        return results;
    }

    @Override
    public List<FeatureRecord> recentFeatures(String symbol, int limit) {
        ensureOpen();
        readCounter.incrementAndGet();

        NavigableSet<String> index = indexes.get(Bucket.FEATURES);
        if (index == null || limit <= 0) {
            return Collections.emptyList();
        }

        String lowest = new TimeSeriesKey(symbol, 0L).toStringKey();
        String highest = new TimeSeriesKey(symbol, Long.MAX_VALUE).toStringKey();

        List<FeatureRecord> newestFirst = new ArrayList<>();
        Iterator<String> it = index.subSet(lowest, true, highest, true).descendingIterator();
        while (it.hasNext() && newestFirst.size() < limit) {
            FeatureRecord record = read(Bucket.FEATURES, symbol, it.next(), FeatureRecord.class);
            if (record != null) {
                newestFirst.add(record);
            }
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public long deleteOlderThan(Bucket bucket, Instant cutoff) {
        ensureOpen();
        NavigableSet<String> index = indexes.get(bucket);
        if (index == null) {
            return 0;
        }

        long cutoffNanos = TimeSeriesKey.clampToEpochNanos(cutoff);
        long deleted = 0;
        for (String key : index) {
            TimeSeriesKey parsed;
            try {
                parsed = TimeSeriesKey.fromStringKey(key);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unparseable key during retention: bucket={}, key={}", bucket.bucketName(), key);
                continue;
            }
            if (parsed.epochNanos() < cutoffNanos && index.remove(key)) {
                map.remove(storageKey(bucket, key));
                deleted++;
            }
        }

        if (deleted > 0) {
            log.info("Deleted {} {} records older than {}", deleted, bucket.bucketName(), cutoff);
        }
        return deleted;
    }

    @Override
    public long count(Bucket bucket) {
        NavigableSet<String> index = indexes.get(bucket);
        return index != null ? index.size() : 0;
    }

    @Override
    public boolean isHealthy() {
        return !closed.get() && map.isOpen();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing Chronicle Map: total_writes={}, total_reads={}, decode_failures={}",
                writeCounter.get(), readCounter.get(), decodeFailures.get());
        try {
            map.close();
        } finally {
            try {
                lock.release();
                lockChannel.close();
            } catch (IOException e) {
                log.warn("Failed to release storage lock", e);
            }
        }
    }

    private <T> T read(Bucket bucket, String symbol, String key, Class<T> type) {
        // Keys of symbols that contain the separator can sort inside another symbol's range
        if (!key.startsWith(TimeSeriesKey.prefix(symbol))
                || key.length() != TimeSeriesKey.prefix(symbol).length() + TimeSeriesKey.TIMESTAMP_WIDTH) {
            return null;
        }

        String payload;
        try {
            payload = map.get(storageKey(bucket, key));
        } catch (RuntimeException e) {
            throw new StorageException("Read failed for " + bucket.bucketName() + " key " + key, e);
        }
        if (payload == null) {
            // Removed by retention after the index snapshot
            return null;
        }

        try {
            return objectMapper.readValue(payload, type);
        } catch (IOException e) {
            decodeFailures.incrementAndGet();
            log.warn("Skipping malformed record: bucket={}, key={}, error={}",
                    bucket.bucketName(), key, e.getMessage());
            return null;
        }
    }

    private NavigableSet<String> indexFor(Bucket bucket) {
        return indexes.computeIfAbsent(bucket, b -> new ConcurrentSkipListSet<>());
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StorageException("Store is closed");
        }
    }

    static String storageKey(Bucket bucket, String key) {
        return bucket.bucketName() + BUCKET_SEPARATOR + key;
    }

    public long getWriteCount() {
        return writeCounter.get();
    }

    public long getReadCount() {
        return readCounter.get();
    }

    public long getDecodeFailures() {
        return decodeFailures.get();
    }
}
