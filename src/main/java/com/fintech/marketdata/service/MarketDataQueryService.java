package com.fintech.marketdata.service;

import com.fintech.marketdata.domain.Bucket;
import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.FeatureRecord;
import com.fintech.marketdata.domain.PriceRecord;
import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.storage.MarketDataStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Read side over the time-series store.
 *
 * Responsibilities:
 * - Input validation (symbol format, time range, limits)
 * - Circuit breaker around store reads
 * - Translating store failures into {@link ServiceException}
 *
 * A disabled store yields empty results rather than errors.
 */
@Service
public class MarketDataQueryService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataQueryService.class);

    public static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9]{3,20}$");
    public static final long MAX_RANGE_MS = 7L * 24 * 60 * 60 * 1000;
    public static final int MAX_LIMIT = 1000;

    private final MarketDataStore store;
    private final CircuitBreaker circuitBreaker;
    private final Counter validationErrors;
    private final Counter serviceErrors;

    public MarketDataQueryService(
            MarketDataStore store,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("marketDataStore");
        this.validationErrors = meterRegistry.counter("query.validation.errors");
        this.serviceErrors = meterRegistry.counter("query.service.errors");

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    public List<Trade> getTrades(String symbol, long fromMs, long toMs) {
        validateRange(symbol, fromMs, toMs);
        return execute("trades", symbol,
            () -> store.getTrades(symbol, Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs)));
    }

    public List<Depth> getDepths(String symbol, long fromMs, long toMs) {
        validateRange(symbol, fromMs, toMs);
        return execute("depths", symbol,
            () -> store.getDepths(symbol, Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs)));
    }

    public List<PriceRecord> getPrices(String symbol, long fromMs, long toMs) {
        validateRange(symbol, fromMs, toMs);
        return execute("prices", symbol,
            () -> store.getPrices(symbol, Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs)));
    }

    /**
     * Features strictly between from and to.
     */
    public List<FeatureRecord> getFeatures(String symbol, long fromMs, long toMs) {
        validateRange(symbol, fromMs, toMs);
        return execute("features", symbol,
            () -> store.getFeatures(symbol, Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs)));
    }

    public List<FeatureRecord> getRecentFeatures(String symbol, int limit) {
        validateSymbol(symbol);
        if (limit < 1 || limit > MAX_LIMIT) {
            validationErrors.increment();
            throw new ValidationException("Limit must be between 1 and " + MAX_LIMIT);
        }
        return execute("recent-features", symbol, () -> store.recentFeatures(symbol, limit));
    }

    /**
     * Returns whether persistence is active, its health and per-bucket record counts.
     */
    public StorageStatus getStorageStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Bucket bucket : Bucket.values()) {
            counts.put(bucket.bucketName(), store.count(bucket));
        }
        return new StorageStatus(store.isEnabled(), store.isHealthy(), counts, circuitBreaker.getState().name());
    }

    /**
     * Get circuit breaker state for monitoring.
     */
    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private <T> List<T> execute(String operation, String symbol, Supplier<List<T>> query) {
        try {
            List<T> results = circuitBreaker.executeSupplier(query);
            if (results == null) {
                log.warn("Store returned null for operation={}, symbol={}", operation, symbol);
                return Collections.emptyList();
            }
            log.debug("Query: operation={}, symbol={}, results={}", operation, symbol, results.size());
            return results;
        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting {} query for symbol={}", operation, symbol);
            throw new ServiceException("Storage circuit breaker is open. System is recovering from errors.", e);
        } catch (RuntimeException e) {
            serviceErrors.increment();
            log.error("Store error during {} query: symbol={}", operation, symbol, e);
            throw new ServiceException("Failed to read " + operation + " from storage", e);
        }
    }

    private void validateRange(String symbol, long fromMs, long toMs) {
        validateSymbol(symbol);

        if (fromMs < 0 || toMs < 0) {
            validationErrors.increment();
            throw new ValidationException("Timestamps cannot be negative");
        }
        if (fromMs >= toMs) {
            validationErrors.increment();
            throw new ValidationException("From time must be less than to time");
        }
        if (toMs - fromMs > MAX_RANGE_MS) {
            validationErrors.increment();
            throw new ValidationException("Time range exceeds maximum allowed (7 days)");
        }
    }

    private void validateSymbol(String symbol) {
        if (symbol == null || !SYMBOL_PATTERN.matcher(symbol).matches()) {
            validationErrors.increment();
            throw new ValidationException("Symbol must be 3-20 uppercase alphanumeric characters");
        }
    }

    /**
     * Storage status snapshot.
     */
    public record StorageStatus(boolean enabled, boolean healthy, Map<String, Long> recordCounts,
                                String circuitBreakerState) {
    }

    /**
     * Business logic validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Service layer exception (wraps storage failures).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
