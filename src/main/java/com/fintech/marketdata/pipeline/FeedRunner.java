package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.ingestion.MarketEventSink;
import com.fintech.marketdata.ingestion.MarketFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a {@link MarketFeed} on its own thread. Cancellation interrupts the
 * thread; a fatal feed fault is reported to the sink's error channel and
 * ends the thread.
 */
public class FeedRunner implements ManagedTask {

    private static final Logger log = LoggerFactory.getLogger(FeedRunner.class);

    private final MarketFeed feed;
    private final List<String> symbols;
    private final MarketEventSink sink;
    private final Thread thread;

    public FeedRunner(MarketFeed feed, Collection<String> symbols, MarketEventSink sink) {
        this.feed = feed;
        this.symbols = List.copyOf(symbols);
        this.sink = sink;
        this.thread = new Thread(this::run, "feed-" + feed.name());
        this.thread.setDaemon(false);
    }

    public void start() {
        thread.start();
    }

    private void run() {
        log.info("Feed started: feed={}, symbols={}", feed.name(), symbols);
        try {
            feed.stream(symbols, sink);
            log.info("Feed returned: feed={}", feed.name());
        } catch (InterruptedException e) {
            log.info("Feed cancelled: feed={}", feed.name());
        } catch (RuntimeException e) {
            log.error("Feed failed: feed={}", feed.name(), e);
            sink.onError(e);
        }
    }

    @Override
    public String taskName() {
        return thread.getName();
    }

    @Override
    public void cancel() {
        thread.interrupt();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long millis = unit.toMillis(timeout);
        if (millis > 0) {
            thread.join(millis);
        }
        return !thread.isAlive();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }
}
