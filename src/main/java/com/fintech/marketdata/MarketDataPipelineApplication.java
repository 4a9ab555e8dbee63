package com.fintech.marketdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Market Data Pipeline
 *
 * Ingests trades and order-book depth from an exchange feed, keeps rolling
 * per-symbol features, hands qualifying observations to a decision component
 * and persists every event and derived record to a time-series store.
 *
 * Key Features:
 * - LMAX Disruptor channels with size/interval batching
 * - Chronicle Map for durable, off-heap storage
 * - Read-only query API over the stored buckets
 * - Prometheus metrics via Micrometer
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class MarketDataPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataPipelineApplication.class, args);
    }
}
