package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.features.FeatureStateRegistry;
import com.fintech.marketdata.features.SymbolFeatureState;
import com.fintech.marketdata.storage.DisabledMarketDataStore;
import com.fintech.marketdata.storage.MarketDataStore;
import com.fintech.marketdata.storage.StorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("TradeBatchProcessor Tests")
class TradeBatchProcessorTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    private FeatureStateRegistry registry;
    private MarketDataStore store;
    private PipelineMetrics metrics;
    private TradeBatchProcessor processor;

    @BeforeEach
    void setUp() {
        registry = new FeatureStateRegistry(List.of("BTCUSDT"), Duration.ofSeconds(30), 600, 50);
        store = mock(MarketDataStore.class);
        metrics = new PipelineMetrics(new SimpleMeterRegistry());
        processor = new TradeBatchProcessor(registry, store, metrics);
    }

    @Test
    @DisplayName("Should update VWAP, ticks and last price for each trade")
    void testFeatureStateUpdated() {
        processor.process(List.of(
            new Trade("BTCUSDT", 100.0, 1.0, T),
            new Trade("BTCUSDT", 102.0, 1.0, T.plusMillis(1)),
            new Trade("BTCUSDT", 101.0, 1.0, T.plusMillis(2))));

        SymbolFeatureState state = registry.get("BTCUSDT");
        assertThat(state.vwap().calculate().vwap()).isCloseTo(101.0, within(1e-9));
        // +1 from the sentinel, +1, -1
        assertThat(state.ticks().ratio()).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(state.ticks().lastSign()).isEqualTo(-1);
        assertThat(registry.lastPrice("BTCUSDT")).hasValue(101.0);
        assertThat(metrics.getTradesReceived()).isEqualTo(3.0);
        assertThat(metrics.getSamplesProcessed()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should persist every trade of a configured symbol")
    void testTradesPersisted() {
        Trade first = new Trade("BTCUSDT", 100.0, 1.0, T);
        Trade second = new Trade("BTCUSDT", 100.0, 2.0, T.plusMillis(1));

        processor.process(List.of(first, second));

        verify(store).saveTrade(first);
        verify(store).saveTrade(second);
        assertThat(registry.get("BTCUSDT").ticks().lastSign()).isZero();
    }

    @Test
    @DisplayName("Should persist trades for unconfigured symbols without creating state")
    void testUnknownSymbol() {
        Trade trade = new Trade("DOGEUSDT", 0.1, 10.0, T);

        processor.process(List.of(trade));

        verify(store).saveTrade(trade);
        assertThat(registry.get("DOGEUSDT")).isNull();
        assertThat(registry.lastPrice("DOGEUSDT")).isEmpty();
        assertThat(metrics.getSkipped(PipelineMetrics.SKIP_UNKNOWN_SYMBOL)).isEqualTo(1.0);
        assertThat(metrics.getTradesReceived()).isEqualTo(1.0);
        assertThat(metrics.getSamplesProcessed()).isZero();
    }

    @Test
    @DisplayName("Should count a rejected VWAP sample but still advance price and ticks")
    void testInvalidSample() {
        processor.process(List.of(new Trade("BTCUSDT", 100.0, Double.NaN, T)));

        assertThat(metrics.getFeatureErrors()).isEqualTo(1.0);
        assertThat(registry.get("BTCUSDT").vwap().size()).isZero();
        assertThat(registry.get("BTCUSDT").ticks().size()).isEqualTo(1);
        assertThat(registry.lastPrice("BTCUSDT")).hasValue(100.0);
        assertThat(metrics.getSamplesProcessed()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep processing when a write fails")
    void testStorageFailure() {
        Trade failing = new Trade("BTCUSDT", 100.0, 1.0, T);
        Trade next = new Trade("BTCUSDT", 101.0, 1.0, T.plusMillis(1));
        doThrow(new StorageException("disk full")).when(store).saveTrade(failing);

        processor.process(List.of(failing, next));

        verify(store, times(2)).saveTrade(any());
        assertThat(metrics.getStorageWriteFailures()).isEqualTo(1.0);
        assertThat(registry.lastPrice("BTCUSDT")).hasValue(101.0);
        assertThat(metrics.getSamplesProcessed()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should process trades against the no-op store")
    void testDisabledStore() {
        TradeBatchProcessor disabled = new TradeBatchProcessor(registry, DisabledMarketDataStore.INSTANCE, metrics);

        disabled.process(List.of(new Trade("BTCUSDT", 100.0, 1.0, T)));

        assertThat(registry.lastPrice("BTCUSDT")).hasValue(100.0);
        assertThat(metrics.getStorageWriteFailures()).isZero();
        assertThat(metrics.getSamplesProcessed()).isEqualTo(1.0);
    }
}
