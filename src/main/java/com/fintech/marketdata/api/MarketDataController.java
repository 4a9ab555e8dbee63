package com.fintech.marketdata.api;

import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.domain.PriceRecord;
import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.service.MarketDataQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Supplier;

/**
 * REST API for querying persisted market data.
 * Times are Unix epoch milliseconds.
 */
@RestController
@RequestMapping("/api/v1/market-data")
@Validated
@Tag(name = "Market Data", description = "Persisted trades, depth snapshots, features and prices")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private static final String SYMBOL_REGEX = "^[A-Z0-9]{3,20}$";
    private static final String SYMBOL_MESSAGE = "Symbol must be 3-20 uppercase alphanumeric characters";

    private final MarketDataQueryService queryService;
    private final MeterRegistry meterRegistry;

    public MarketDataController(MarketDataQueryService queryService, MeterRegistry meterRegistry) {
        this.queryService = queryService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/market-data/trades
     *
     * Trades with from &lt;= ts &lt;= to.
     */
    @Operation(
        summary = "Get trades in a time range",
        description = """
            Returns executed trades for a symbol with `from <= ts <= to`, oldest first.

            **Example Request:**
            ```
            GET /api/v1/market-data/trades?symbol=BTCUSDT&from=1733529420000&to=1733533020000
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successfully retrieved trades",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = MarketDataResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "bucket": "trades",
                          "symbol": "BTCUSDT",
                          "count": 2,
                          "records": [
                            {"symbol": "BTCUSDT", "price": 42500.5, "qty": 0.25, "ts": "2024-12-07T00:37:00Z"},
                            {"symbol": "BTCUSDT", "price": 42501.0, "qty": 0.10, "ts": "2024-12-07T00:37:01Z"}
                          ]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "500",
            description = "Storage failure",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/trades")
    public ResponseEntity<MarketDataResponse<Trade>> getTrades(
            @Parameter(description = "Trading symbol", example = "BTCUSDT", required = true)
            @RequestParam @Pattern(regexp = SYMBOL_REGEX, message = SYMBOL_MESSAGE) String symbol,
            @Parameter(description = "Start time, inclusive (epoch millis)", example = "1733529420000", required = true)
            @RequestParam long from,
            @Parameter(description = "End time, inclusive (epoch millis)", example = "1733533020000", required = true)
            @RequestParam long to) {
        return timed("trades", () -> MarketDataResponse.of("trades", symbol,
                queryService.getTrades(symbol, from, to)));
    }

    /**
     * GET /api/v1/market-data/depths
     */
    @Operation(summary = "Get depth snapshots in a time range",
               description = "Returns order-book volume snapshots with `from <= ts <= to`, oldest first.")
    @GetMapping("/depths")
    public ResponseEntity<MarketDataResponse<Depth>> getDepths(
            @Parameter(description = "Trading symbol", example = "BTCUSDT", required = true)
            @RequestParam @Pattern(regexp = SYMBOL_REGEX, message = SYMBOL_MESSAGE) String symbol,
            @Parameter(description = "Start time, inclusive (epoch millis)", required = true)
            @RequestParam long from,
            @Parameter(description = "End time, inclusive (epoch millis)", required = true)
            @RequestParam long to) {
        return timed("depths", () -> MarketDataResponse.of("depths", symbol,
                queryService.getDepths(symbol, from, to)));
    }

    /**
     * GET /api/v1/market-data/prices
     */
    @Operation(summary = "Get price snapshots in a time range",
               description = "Returns price/VWAP records with `from <= timestamp <= to`, oldest first.")
    @GetMapping("/prices")
    public ResponseEntity<MarketDataResponse<PriceRecord>> getPrices(
            @Parameter(description = "Trading symbol", example = "BTCUSDT", required = true)
            @RequestParam @Pattern(regexp = SYMBOL_REGEX, message = SYMBOL_MESSAGE) String symbol,
            @Parameter(description = "Start time, inclusive (epoch millis)", required = true)
            @RequestParam long from,
            @Parameter(description = "End time, inclusive (epoch millis)", required = true)
            @RequestParam long to) {
        return timed("prices", () -> MarketDataResponse.of("prices", symbol,
                queryService.getPrices(symbol, from, to)));
    }

    /**
     * GET /api/v1/market-data/features
     *
     * Unlike the other buckets both bounds are exclusive.
     */
    @Operation(summary = "Get feature records in a time range",
               description = "Returns derived feature records with `from < timestamp < to` (exclusive), oldest first.")
    @GetMapping("/features")
    public ResponseEntity<MarketDataResponse<FeatureRecord>> getFeatures(
            @Parameter(description = "Trading symbol", example = "BTCUSDT", required = true)
            @RequestParam @Pattern(regexp = SYMBOL_REGEX, message = SYMBOL_MESSAGE) String symbol,
            @Parameter(description = "Start time, exclusive (epoch millis)", required = true)
            @RequestParam long from,
            @Parameter(description = "End time, exclusive (epoch millis)", required = true)
            @RequestParam long to) {
        return timed("features", () -> MarketDataResponse.of("features", symbol,
                queryService.getFeatures(symbol, from, to)));
    }

    /**
     * GET /api/v1/market-data/features/recent
     */
    @Operation(summary = "Get the most recent feature records",
               description = "Returns the newest `limit` feature records for a symbol, oldest first.")
    @GetMapping("/features/recent")
    public ResponseEntity<MarketDataResponse<FeatureRecord>> getRecentFeatures(
            @Parameter(description = "Trading symbol", example = "BTCUSDT", required = true)
            @RequestParam @Pattern(regexp = SYMBOL_REGEX, message = SYMBOL_MESSAGE) String symbol,
            @Parameter(description = "Maximum number of records (1-1000)", example = "100")
            @RequestParam(defaultValue = "100")
            @Min(value = 1, message = "Limit must be at least 1")
            @Max(value = 1000, message = "Limit must be at most 1000")
            int limit) {
        return timed("features-recent", () -> MarketDataResponse.of("features", symbol,
                queryService.getRecentFeatures(symbol, limit)));
    }

    private <T> ResponseEntity<MarketDataResponse<T>> timed(String endpoint, Supplier<MarketDataResponse<T>> query) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            MarketDataResponse<T> response = query.get();
            log.debug("Query served: endpoint={}, symbol={}, results={}",
                    endpoint, response.symbol(), response.count());
            return ResponseEntity.ok(response);
        } finally {
            sample.stop(meterRegistry.timer("api.market-data.request.time", "endpoint", endpoint));
        }
    }
}
