package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.config.PipelineProperties;
import com.fintech.marketdata.decision.DecisionDispatcher;
import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.features.FeatureStateRegistry;
import com.fintech.marketdata.ingestion.MarketEventSink;
import com.fintech.marketdata.ingestion.MarketFeed;
import com.fintech.marketdata.storage.DisabledMarketDataStore;
import com.fintech.marketdata.storage.MarketDataStore;
import com.fintech.marketdata.storage.MarketDataStoreFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("MarketDataPipeline Tests")
class MarketDataPipelineTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    Path dataDir;

    private PipelineProperties properties;
    private FeatureStateRegistry registry;
    private MarketDataStore store;
    private DecisionDispatcher dispatcher;
    private PipelineMetrics metrics;
    private MarketDataPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        properties = new PipelineProperties();
        properties.setSymbols(List.of("BTCUSDT", "ETHUSDT"));
        properties.getStorage().setDataPath(dataDir.toString());
        properties.getStorage().setEntries(10_000L);
        properties.getShutdown().setDrainTimeout(Duration.ofSeconds(5));

        PipelineProperties.Features features = properties.getFeatures();
        registry = new FeatureStateRegistry(properties.getSymbols(), features.getVwapWindow(),
                features.getVwapSize(), features.getTickSize());
        store = MarketDataStoreFactory.open(properties.getStorage(), MarketDataStoreFactory.defaultObjectMapper());
        dispatcher = mock(DecisionDispatcher.class);
        metrics = new PipelineMetrics(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.shutdown();
        }
        store.close();
    }

    @Test
    @DisplayName("Should turn trades and a depth snapshot into a dispatched and stored feature")
    void testEndToEnd() throws InterruptedException {
        pipeline = new MarketDataPipeline(properties, registry, store, dispatcher, metrics, Optional.empty());
        pipeline.start();

        assertThat(pipeline.onTrade(new Trade("BTCUSDT", 100.0, 1.0, T))).isTrue();
        assertThat(pipeline.onTrade(new Trade("BTCUSDT", 102.0, 1.0, T.plusMillis(1)))).isTrue();
        awaitCount(metrics::getSamplesProcessed, 2.0);

        assertThat(pipeline.onDepth(new Depth("BTCUSDT", 30.0, 10.0, 102.0, T.plusMillis(2)))).isTrue();

        verify(dispatcher, timeout(5_000)).attemptDecision(eq("BTCUSDT"), eq(102.0), eq(101.0), eq(1.0),
                eq(1.0), eq(0.5), eq(30.0), eq(10.0));
        awaitCount(metrics::getSamplesProcessed, 3.0);

        assertThat(store.getTrades("BTCUSDT", T, T.plusSeconds(1))).hasSize(2);
        assertThat(store.getDepths("BTCUSDT", T, T.plusSeconds(1))).hasSize(1);
        List<FeatureRecord> features = store.recentFeatures("BTCUSDT", 10);
        assertThat(features).hasSize(1);
        assertThat(features.get(0).priceDist()).isEqualTo(1.0);
        assertThat(store.getPrices("BTCUSDT", T, T.plusSeconds(1))).hasSize(1);
        assertThat(metrics.getTradesReceived()).isEqualTo(2.0);
        assertThat(metrics.getDepthsReceived()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should run without persistence when the store is disabled")
    void testDisabledStore() throws InterruptedException {
        pipeline = new MarketDataPipeline(properties, registry, DisabledMarketDataStore.INSTANCE,
                dispatcher, metrics, Optional.empty());
        pipeline.start();

        pipeline.onTrade(new Trade("BTCUSDT", 100.0, 1.0, T));
        pipeline.onTrade(new Trade("BTCUSDT", 104.0, 1.0, T.plusMillis(1)));
        awaitCount(metrics::getSamplesProcessed, 2.0);
        pipeline.onDepth(new Depth("BTCUSDT", 10.0, 10.0, 104.0, T.plusMillis(2)));

        verify(dispatcher, timeout(5_000)).attemptDecision(eq("BTCUSDT"), eq(104.0), eq(102.0), eq(2.0),
                anyDouble(), eq(0.0), eq(10.0), eq(10.0));
        assertThat(store.getTrades("BTCUSDT", T, T.plusSeconds(1))).isEmpty();
    }

    @Test
    @DisplayName("Should stream events from the configured feed and stop it on shutdown")
    void testFeedLifecycle() throws InterruptedException {
        CountDownLatch emitted = new CountDownLatch(1);
        MarketFeed feed = new MarketFeed() {
            @Override
            public void stream(Collection<String> symbols, MarketEventSink sink) throws InterruptedException {
                for (String symbol : symbols) {
                    sink.onTrade(new Trade(symbol, 10.0, 1.0, T));
                }
                emitted.countDown();
                new CountDownLatch(1).await();
            }

            @Override
            public String name() {
                return "test";
            }
        };
        pipeline = new MarketDataPipeline(properties, registry, store, dispatcher, metrics, Optional.of(feed));
        pipeline.start();

        assertThat(emitted.await(5, TimeUnit.SECONDS)).isTrue();
        awaitCount(metrics::getSamplesProcessed, 2.0);
        assertThat(registry.lastPrice("ETHUSDT")).hasValue(10.0);

        assertThat(pipeline.shutdown()).isTrue();
        assertThat(pipeline.isRunning()).isFalse();
        assertThat(pipeline.onTrade(new Trade("BTCUSDT", 11.0, 1.0, T.plusSeconds(1)))).isFalse();
    }

    @Test
    @DisplayName("Should report a failing feed through the error channel")
    void testFeedFailure() throws InterruptedException {
        MarketFeed feed = (symbols, sink) -> {
            throw new IllegalStateException("connection refused");
        };
        pipeline = new MarketDataPipeline(properties, registry, store, dispatcher, metrics, Optional.of(feed));
        pipeline.start();

        awaitCount(metrics::getErrors, 1.0);

        assertThat(metrics.getReconnects()).isEqualTo(1.0);
        assertThat(pipeline.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should tolerate repeated start and shutdown calls")
    void testIdempotentLifecycle() {
        pipeline = new MarketDataPipeline(properties, registry, store, dispatcher, metrics, Optional.empty());

        assertThat(pipeline.shutdown()).isTrue();
        pipeline.start();
        pipeline.start();
        assertThat(pipeline.isRunning()).isTrue();

        assertThat(pipeline.shutdown()).isTrue();
        assertThat(pipeline.shutdown()).isTrue();
    }

    private static void awaitCount(DoubleSupplier counter, double expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (counter.getAsDouble() < expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(counter.getAsDouble()).isGreaterThanOrEqualTo(expected);
    }
}
