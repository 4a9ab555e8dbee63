package com.fintech.marketdata.storage;

import com.fintech.marketdata.config.PipelineProperties;
import com.fintech.marketdata.domain.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodically removes records older than {@code pipeline.storage.retention}.
 * A zero or negative retention keeps everything.
 */
@Component
public class StorageRetentionTask {

    private static final Logger log = LoggerFactory.getLogger(StorageRetentionTask.class);

    private final MarketDataStore store;
    private final PipelineProperties properties;
    private final Clock clock;

    public StorageRetentionTask(MarketDataStore store, PipelineProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${pipeline.storage.retention-check-ms:60000}",
               initialDelayString = "${pipeline.storage.retention-check-ms:60000}")
    public void purgeExpired() {
        Duration retention = properties.getStorage().getRetention();
        if (retention == null || retention.isZero() || retention.isNegative() || !store.isEnabled()) {
            return;
        }

        Instant cutoff = clock.instant().minus(retention);
        long total = 0;
        for (Bucket bucket : Bucket.values()) {
            try {
                total += store.deleteOlderThan(bucket, cutoff);
            } catch (StorageException e) {
                log.error("Retention pass failed for bucket={}", bucket.bucketName(), e);
            }
        }

        if (total > 0) {
            log.info("Retention pass removed {} records older than {}", total, cutoff);
        }
    }
}
