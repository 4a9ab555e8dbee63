package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.config.PipelineProperties;
import com.fintech.marketdata.decision.DecisionDispatcher;
import com.fintech.marketdata.domain.Depth;
import com.fintech.marketdata.domain.Trade;
import com.fintech.marketdata.features.FeatureStateRegistry;
import com.fintech.marketdata.ingestion.EventChannel;
import com.fintech.marketdata.ingestion.MarketEventSink;
import com.fintech.marketdata.ingestion.MarketFeed;
import com.fintech.marketdata.storage.MarketDataStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Wires feed, channels, batch accumulators and the error reporter together
 * and owns their lifecycle.
 *
 * Flow: feed -> trade/depth channels -> batch accumulators -> feature state,
 * decision dispatch and persistence. Stream faults travel separately through
 * the error channel to the {@link ErrorReporter}.
 */
@Component
public class MarketDataPipeline implements MarketEventSink {

    private static final Logger log = LoggerFactory.getLogger(MarketDataPipeline.class);

    public static final String TRADES_STREAM = "trades";
    public static final String DEPTHS_STREAM = "depths";
    public static final String ERRORS_STREAM = "errors";

    private final PipelineProperties properties;
    private final FeatureStateRegistry registry;
    private final MarketDataStore store;
    private final DecisionDispatcher dispatcher;
    private final PipelineMetrics metrics;
    private final Optional<MarketFeed> feed;

    private final EventChannel<Trade> tradeChannel;
    private final EventChannel<Depth> depthChannel;
    private final EventChannel<Throwable> errorChannel;
    private final ShutdownCoordinator coordinator;

    private FeedRunner feedRunner;
    private volatile boolean started;

    public MarketDataPipeline(
            PipelineProperties properties,
            FeatureStateRegistry registry,
            MarketDataStore store,
            DecisionDispatcher dispatcher,
            PipelineMetrics metrics,
            Optional<MarketFeed> feed) {
        this.properties = properties;
        this.registry = registry;
        this.store = store;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.feed = feed;

        PipelineProperties.Batching batching = properties.getBatching();
        this.tradeChannel = new EventChannel<>(TRADES_STREAM, batching.getTradeCapacity(),
                batching.getFlushInterval(), batching.getWaitStrategy());
        this.depthChannel = new EventChannel<>(DEPTHS_STREAM, batching.getDepthCapacity(),
                batching.getFlushInterval(), batching.getWaitStrategy());
        this.errorChannel = new EventChannel<>(ERRORS_STREAM, batching.getErrorCapacity(),
                batching.getFlushInterval(), batching.getWaitStrategy());
        this.coordinator = new ShutdownCoordinator(properties.getShutdown().getDrainTimeout());
    }

    @PostConstruct
    public synchronized void start() {
        if (started) {
            return;
        }
        PipelineProperties.Batching batching = properties.getBatching();

        errorChannel.start(new ErrorReporter(metrics));
        tradeChannel.start(new BatchAccumulator<>(TRADES_STREAM, batching.getTradeBatchSize(),
                batching.getFlushInterval(), new TradeBatchProcessor(registry, store, metrics), metrics));
        depthChannel.start(new BatchAccumulator<>(DEPTHS_STREAM, batching.getDepthBatchSize(),
                batching.getFlushInterval(), new DepthBatchProcessor(registry, dispatcher, store, metrics), metrics));

        feed.ifPresentOrElse(f -> {
            feedRunner = new FeedRunner(f, registry.symbols(), this);
            coordinator.register(feedRunner);
        }, () -> log.info("No market feed configured; pipeline accepts events via publish only"));

        coordinator.register(channelTask(tradeChannel));
        coordinator.register(channelTask(depthChannel));
        coordinator.register(channelTask(errorChannel));

        if (feedRunner != null) {
            feedRunner.start();
        }
        started = true;

        log.info("Market data pipeline started: symbols={}, storageEnabled={}",
                registry.symbols(), store.isEnabled());
    }

    @Override
    public boolean onTrade(Trade trade) {
        return tradeChannel.publish(trade);
    }

    @Override
    public boolean onDepth(Depth depth) {
        return depthChannel.publish(depth);
    }

    @Override
    public void onError(Throwable error) {
        if (!errorChannel.tryPublish(error)) {
            log.warn("Error channel full or closed, dropping report: {}", error.toString());
        }
    }

    /**
     * Stops the feed and all consumers. Partial batches are discarded.
     *
     * @return true if every task stopped within the drain timeout
     */
    @PreDestroy
    public boolean shutdown() {
        if (!started) {
            return true;
        }
        return coordinator.shutdown();
    }

    public boolean isRunning() {
        return started && !coordinator.isShutdown();
    }

    private static ManagedTask channelTask(EventChannel<?> channel) {
        return ManagedTask.of(channel.getName() + "-consumer", channel::halt, channel::awaitTermination);
    }
}
