package com.fintech.marketdata.api;

import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.storage.MarketDataStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
    "pipeline.simulation.enabled=false",
    "spring.jmx.enabled=false",
    "pipeline.storage.entries=10000",
    "pipeline.storage.data-path=target/test-api-${random.uuid}"
})
@DisplayName("MarketDataController Integration Tests")
class MarketDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MarketDataStore store;

    @Test
    @DisplayName("Should return trades in the requested range, oldest first")
    void testTrades() throws Exception {
        long base = 1_700_000_000_000L;
        store.saveTrade(new Trade("BTCUSDT", 42_001.0, 0.2, Instant.ofEpochMilli(base + 1_000)));
        store.saveTrade(new Trade("BTCUSDT", 42_000.0, 0.1, Instant.ofEpochMilli(base)));
        store.saveTrade(new Trade("BTCUSDT", 42_002.0, 0.3, Instant.ofEpochMilli(base + 10_000)));

        mockMvc.perform(get("/api/v1/market-data/trades")
                .param("symbol", "BTCUSDT")
                .param("from", String.valueOf(base))
                .param("to", String.valueOf(base + 5_000)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bucket").value("trades"))
            .andExpect(jsonPath("$.symbol").value("BTCUSDT"))
            .andExpect(jsonPath("$.count").value(2))
            .andExpect(jsonPath("$.records", hasSize(2)))
            .andExpect(jsonPath("$.records[0].price").value(42_000.0))
            .andExpect(jsonPath("$.records[1].qty").value(0.2));
    }

    @Test
    @DisplayName("Should serialize depth snapshots with snake_case fields")
    void testDepths() throws Exception {
        long base = 1_700_100_000_000L;
        store.saveDepth(new Depth("ETHUSDT", 12.5, 7.5, 2_250.0, Instant.ofEpochMilli(base)));

        mockMvc.perform(get("/api/v1/market-data/depths")
                .param("symbol", "ETHUSDT")
                .param("from", String.valueOf(base))
                .param("to", String.valueOf(base + 1)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.records[0].bid_vol").value(12.5))
            .andExpect(jsonPath("$.records[0].ask_vol").value(7.5))
            .andExpect(jsonPath("$.records[0].last_price").value(2_250.0));
    }

    @Test
    @DisplayName("Should exclude features on the range bounds")
    void testFeaturesExclusive() throws Exception {
        long base = 1_700_200_000_000L;
        for (int i = 0; i < 3; i++) {
            store.saveFeature(FeatureRecord.of("SOLUSDT", Instant.ofEpochMilli(base + i * 1_000L),
                    95.0 + i, 95.0, 1.0, 0.0, 0.0, 10.0, 10.0));
        }

        mockMvc.perform(get("/api/v1/market-data/features")
                .param("symbol", "SOLUSDT")
                .param("from", String.valueOf(base))
                .param("to", String.valueOf(base + 2_000)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.records[0].price").value(96.0))
            .andExpect(jsonPath("$.records[0].price_dist").value(1.0));
    }

    @Test
    @DisplayName("Should return the most recent features up to the limit")
    void testRecentFeatures() throws Exception {
        long base = 1_700_300_000_000L;
        for (int i = 0; i < 5; i++) {
            store.saveFeature(FeatureRecord.of("ADAUSDT", Instant.ofEpochMilli(base + i),
                    0.5 + i, 0.5, 0.1, 0.0, 0.0, 1.0, 1.0));
        }

        mockMvc.perform(get("/api/v1/market-data/features/recent")
                .param("symbol", "ADAUSDT")
                .param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.records", hasSize(2)))
            .andExpect(jsonPath("$.records[0].price").value(3.5))
            .andExpect(jsonPath("$.records[1].price").value(4.5));
    }

    @Test
    @DisplayName("Should return an empty list when nothing was stored")
    void testEmptyResult() throws Exception {
        mockMvc.perform(get("/api/v1/market-data/prices")
                .param("symbol", "DOTUSDT")
                .param("from", "1900000000000")
                .param("to", "1900000002000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(0))
            .andExpect(jsonPath("$.records", hasSize(0)));
    }

    @Test
    @DisplayName("Should reject lowercase symbols")
    void testInvalidSymbol() throws Exception {
        mockMvc.perform(get("/api/v1/market-data/trades")
                .param("symbol", "btcusdt")
                .param("from", "1700000000000")
                .param("to", "1700000001000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.validationErrors[0].field").value("symbol"));
    }

    @Test
    @DisplayName("Should reject an inverted time range")
    void testInvertedRange() throws Exception {
        mockMvc.perform(get("/api/v1/market-data/trades")
                .param("symbol", "BTCUSDT")
                .param("from", "1700000001000")
                .param("to", "1700000000000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("SERVICE_VALIDATION_ERROR"))
            .andExpect(jsonPath("$.path").value("/api/v1/market-data/trades"));
    }

    @Test
    @DisplayName("Should reject a missing parameter")
    void testMissingParameter() throws Exception {
        mockMvc.perform(get("/api/v1/market-data/trades")
                .param("symbol", "BTCUSDT")
                .param("from", "1700000000000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_PARAMETER"))
            .andExpect(jsonPath("$.validationErrors[0].field").value("to"));
    }

    @Test
    @DisplayName("Should reject a non-numeric timestamp")
    void testTypeMismatch() throws Exception {
        mockMvc.perform(get("/api/v1/market-data/depths")
                .param("symbol", "BTCUSDT")
                .param("from", "yesterday")
                .param("to", "1700000000000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("TYPE_MISMATCH"));
    }

    @Test
    @DisplayName("Should reject a limit above the maximum")
    void testLimitTooLarge() throws Exception {
        mockMvc.perform(get("/api/v1/market-data/features/recent")
                .param("symbol", "BTCUSDT")
                .param("limit", "5000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }
}
