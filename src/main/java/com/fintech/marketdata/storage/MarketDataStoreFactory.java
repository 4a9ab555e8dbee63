package com.fintech.marketdata.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fintech.marketdata.config.PipelineProperties;
import net.openhft.chronicle.map.ChronicleMap;
import net.openhft.chronicle.map.ChronicleMapBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Opens the Chronicle Map store for a data directory.
 *
 * The directory holds one data file and one lock file. An exclusive lock on
 * the lock file is taken before the map is touched, so two processes (or two
 * stores in one JVM) never recover the same file concurrently.
 */
public final class MarketDataStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(MarketDataStoreFactory.class);

    public static final String DATA_FILE = "market-data.dat";
    public static final String LOCK_FILE = "market-data.lock";

    private static final long LOCK_RETRY_MILLIS = 50L;

    private MarketDataStoreFactory() {
    }

    /**
     * Opens (creating or recovering) the store under {@code settings.dataPath}.
     *
     * @throws StorageUnavailableException if the directory cannot be used, the
     *         lock is not acquired within the lock timeout, or the engine fails
     */
    public static MarketDataStore open(PipelineProperties.Storage settings, ObjectMapper objectMapper)
            throws StorageUnavailableException {
        Path dir = Path.of(settings.getDataPath()).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        } catch (IOException | SecurityException e) {
            throw new StorageUnavailableException("Cannot create data directory " + dir, e);
        }
        if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            throw new StorageUnavailableException("Data directory is not writable: " + dir);
        }

        FileChannel lockChannel;
        try {
            lockChannel = FileChannel.open(dir.resolve(LOCK_FILE),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot open lock file in " + dir, e);
        }

        FileLock lock = acquireLock(lockChannel, dir, settings.getLockTimeout().toMillis());

        try {
            ChronicleMap<String, String> map = mapBuilder(settings)
                .createOrRecoverPersistedTo(dir.resolve(DATA_FILE).toFile());
            log.info("Chronicle Map opened: path={}, existing_entries={}", dir.resolve(DATA_FILE), map.size());
            return new ChronicleMapMarketDataStore(map, objectMapper, lockChannel, lock);
        } catch (IOException | RuntimeException e) {
            releaseQuietly(lockChannel, lock);
            throw new StorageUnavailableException("Chronicle Map initialization failed in " + dir, e);
        }
    }

    /**
     * Opens the store, or returns the no-op store when persistence is disabled
     * or cannot be initialised. The pipeline keeps running either way.
     */
    public static MarketDataStore openOrDisabled(PipelineProperties.Storage settings, ObjectMapper objectMapper) {
        if (!settings.isEnabled()) {
            log.info("Persistence disabled by configuration");
            return DisabledMarketDataStore.INSTANCE;
        }
        try {
            return open(settings, objectMapper);
        } catch (StorageUnavailableException e) {
            log.warn("Persistence unavailable, continuing without storage: {}", e.getMessage(), e);
            return DisabledMarketDataStore.INSTANCE;
        }
    }

    /**
     * Returns the mapper used for stored payloads: ISO-8601 instants with
     * nanosecond precision, unknown fields ignored on read.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    static ChronicleMapBuilder<String, String> mapBuilder(PipelineProperties.Storage settings) {
        return ChronicleMap
            .of(String.class, String.class)
            .name("market-data")
            .entries(settings.getEntries())
            .averageKeySize(settings.getAverageKeySize())
            .averageValueSize(settings.getAverageValueSize());
    }

    private static FileLock acquireLock(FileChannel channel, Path dir, long timeoutMillis)
            throws StorageUnavailableException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (true) {
            try {
                FileLock lock = channel.tryLock();
                if (lock != null) {
                    return lock;
                }
            } catch (OverlappingFileLockException e) {
                // Held by this JVM; waiting will not help
                releaseQuietly(channel, null);
                throw new StorageUnavailableException("Store already open in this process: " + dir, e);
            } catch (IOException e) {
                releaseQuietly(channel, null);
                throw new StorageUnavailableException("Cannot lock " + dir, e);
            }

            if (System.currentTimeMillis() >= deadline) {
                releaseQuietly(channel, null);
                throw new StorageUnavailableException("Timed out waiting for lock on " + dir);
            }
            try {
                Thread.sleep(LOCK_RETRY_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                releaseQuietly(channel, null);
                throw new StorageUnavailableException("Interrupted waiting for lock on " + dir, e);
            }
        }
    }

    private static void releaseQuietly(FileChannel channel, FileLock lock) {
        try {
            if (lock != null) {
                lock.release();
            }
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to release storage lock", e);
        }
    }
}
