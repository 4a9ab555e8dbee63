package com.fintech.marketdata.config;

import com.fintech.marketdata.decision.DecisionDispatcher;
import com.fintech.marketdata.decision.LoggingDecisionDispatcher;
import com.fintech.marketdata.features.FeatureStateRegistry;
import com.fintech.marketdata.storage.MarketDataStore;
import com.fintech.marketdata.storage.MarketDataStoreFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One accumulator set per configured symbol, created before any consumer starts.
     */
    @Bean
    public FeatureStateRegistry featureStateRegistry(PipelineProperties properties) {
        PipelineProperties.Features features = properties.getFeatures();
        return new FeatureStateRegistry(
            properties.getSymbols(),
            features.getVwapWindow(),
            features.getVwapSize(),
            features.getTickSize()
        );
    }

    /**
     * Falls back to the no-op store when the data directory cannot be opened.
     */
    @Bean(destroyMethod = "close")
    public MarketDataStore marketDataStore(PipelineProperties properties) {
        return MarketDataStoreFactory.openOrDisabled(
            properties.getStorage(),
            MarketDataStoreFactory.defaultObjectMapper()
        );
    }

    @Bean
    @ConditionalOnMissingBean(DecisionDispatcher.class)
    public DecisionDispatcher decisionDispatcher() {
        return new LoggingDecisionDispatcher();
    }
}
