package com.fintech.marketdata.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration: common tags and percentile settings for timers.
 *
 * Batch processing is synchronous on the consumer thread (feature update,
 * dispatch and persistence), so the SLO buckets span microseconds up to the
 * tens of milliseconds a slow disk flush can take.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(
            @Value("${spring.application.name:market-data-pipeline}") String applicationName) {
        return registry -> {
            registry.config().commonTags(
                "application", applicationName,
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99, 0.999)
                        .percentilePrecision(2)
                        // Timer SLOs are in nanoseconds: 10μs .. 50ms
                        .serviceLevelObjectives(
                            10_000, 50_000, 100_000, 500_000,
                            1_000_000, 5_000_000, 10_000_000, 50_000_000
                        )
                        .percentilesHistogram(true)
                        // Discard samples older than 60s
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    /**
     * Detect environment from the active profile.
     */
    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
