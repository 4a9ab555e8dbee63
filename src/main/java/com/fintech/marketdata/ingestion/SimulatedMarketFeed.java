package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.config.PipelineProperties;
import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulates an exchange feed for local runs and demos.
 *
 * Generates trades from a random walk per symbol, each followed by a depth
 * snapshot with random bid/ask volumes around the current price.
 *
 * Disabled by default; enable with pipeline.simulation.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "pipeline.simulation.enabled", havingValue = "true", matchIfMissing = false)
public class SimulatedMarketFeed implements MarketFeed {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketFeed.class);

    // Initial prices for different symbols
    private static final Map<String, Double> INITIAL_PRICES = Map.of(
        "BTCUSDT", 42500.0,
        "ETHUSDT", 2250.0,
        "SOLUSDT", 95.5,
        "ADAUSDT", 0.58,
        "DOTUSDT", 7.25
    );

    // Volatility parameters (as fraction of price per tick)
    private static final Map<String, Double> VOLATILITIES = Map.of(
        "BTCUSDT", 0.0002,
        "ETHUSDT", 0.0003,
        "SOLUSDT", 0.0005,
        "ADAUSDT", 0.0008,
        "DOTUSDT", 0.0006
    );

    private final PipelineProperties properties;
    private final Clock clock;
    private final Map<String, Double> currentPrices = new ConcurrentHashMap<>();
    private volatile long eventsGenerated = 0;

    public SimulatedMarketFeed(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void stream(Collection<String> symbols, MarketEventSink sink) throws InterruptedException {
        for (String symbol : symbols) {
            currentPrices.putIfAbsent(symbol, INITIAL_PRICES.getOrDefault(symbol, 100.0));
            log.info("Simulating {} from ${}", symbol, currentPrices.get(symbol));
        }

        long sleepMs = Math.max(1L, properties.getSimulation().getUpdateFrequencyMs());
        int eventsPerTick = Math.max(1, properties.getSimulation().getEventsPerTick());

        while (!Thread.currentThread().isInterrupted()) {
            Instant now = clock.instant();
            for (String symbol : symbols) {
                for (int i = 0; i < eventsPerTick; i++) {
                    // Nanosecond offset keeps keys of one tick distinct
                    Instant ts = now.plusNanos(i);
                    double price = updatePrice(symbol);
                    double qty = ThreadLocalRandom.current().nextDouble(0.001, 2.0);

                    if (!sink.onTrade(new Trade(symbol, price, qty, ts))) {
                        log.info("Simulated feed stopped after {} events", eventsGenerated);
                        return;
                    }
                    if (!sink.onDepth(randomDepth(symbol, price, ts))) {
                        log.info("Simulated feed stopped after {} events", eventsGenerated);
                        return;
                    }
                    eventsGenerated += 2;
                }
            }

            if (eventsGenerated % 100000 == 0) {
                log.info("Generated {} market data events", eventsGenerated);
            }
            Thread.sleep(sleepMs);
        }
        throw new InterruptedException("Simulated feed interrupted");
    }

    /**
     * Updates price using a bounded random walk.
     *
     * @param symbol The trading pair
     * @return New price
     */
    private double updatePrice(String symbol) {
        double currentPrice = currentPrices.get(symbol);
        double volatility = VOLATILITIES.getOrDefault(symbol, 0.0003);

        double maxChange = currentPrice * volatility;
        double change = ThreadLocalRandom.current().nextDouble(-maxChange, maxChange);

        double newPrice = currentPrice + change;
        if (newPrice <= 0) {
            newPrice = currentPrice;
        }

        currentPrices.put(symbol, newPrice);
        return newPrice;
    }

    private Depth randomDepth(String symbol, double price, Instant ts) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return new Depth(symbol, random.nextDouble(1.0, 50.0), random.nextDouble(1.0, 50.0), price, ts);
    }

    @Override
    public String name() {
        return "simulated";
    }

    public long getEventsGenerated() {
        return eventsGenerated;
    }
}
