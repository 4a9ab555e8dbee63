package com.fintech.marketdata.api;

import com.fintech.marketdata.service.MarketDataQueryService;
import com.fintech.marketdata.service.MarketDataQueryService.StorageStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for monitoring the time-series store.
 */
@RestController
@RequestMapping("/api/v1/storage")
@Tag(name = "Monitoring", description = "Storage status")
public class StorageStatusController {

    private final MarketDataQueryService queryService;

    public StorageStatusController(MarketDataQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Get storage status.
     *
     * Example response:
     * {
     *   "enabled": true,
     *   "healthy": true,
     *   "recordCounts": {"trades": 1200, "depths": 800, "features": 640, "prices": 640},
     *   "circuitBreakerState": "CLOSED"
     * }
     */
    @Operation(summary = "Get storage status",
               description = "Whether persistence is enabled, its health and per-bucket record counts.")
    @GetMapping("/status")
    public ResponseEntity<StorageStatus> getStorageStatus() {
        return ResponseEntity.ok(queryService.getStorageStatus());
    }
}
