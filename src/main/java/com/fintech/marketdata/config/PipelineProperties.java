package com.fintech.marketdata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Externalized configuration for the market data pipeline.
 * Maps to 'pipeline.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private List<String> symbols = List.of("BTCUSDT", "ETHUSDT");
    private Features features = new Features();
    private Batching batching = new Batching();
    private Storage storage = new Storage();
    private Shutdown shutdown = new Shutdown();
    private Simulation simulation = new Simulation();

    @Data
    public static class Features {
        private Duration vwapWindow = Duration.ofSeconds(30);
        private int vwapSize = 600;
        private int tickSize = 50;
    }

    @Data
    public static class Batching {
        private int tradeBatchSize = 20;
        private int depthBatchSize = 10;
        private Duration flushInterval = Duration.ofMillis(1);
        // Ring capacities must be powers of two
        private int tradeCapacity = 64;
        private int depthCapacity = 64;
        private int errorCapacity = 32;
        private String waitStrategy = "TIMEOUT_BLOCKING";
    }

    @Data
    public static class Storage {
        private boolean enabled = true;
        private String dataPath = "data";
        private long entries = 5_000_000L;
        private int averageKeySize = 40;
        private int averageValueSize = 256;
        private Duration lockTimeout = Duration.ofSeconds(1);
        // Zero disables the retention task
        private Duration retention = Duration.ZERO;
        private long retentionCheckMs = 60_000L;
    }

    @Data
    public static class Shutdown {
        private Duration drainTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private long updateFrequencyMs = 100L;
        private int eventsPerTick = 1;
    }
}
