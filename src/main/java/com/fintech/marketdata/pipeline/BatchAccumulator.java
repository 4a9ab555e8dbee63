package com.fintech.marketdata.pipeline;

import com.fintech.marketdata.ingestion.EventChannel;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.TimeoutHandler;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Consumer side of one event channel: buffers events and hands them to a
 * {@link BatchProcessor} when the buffer reaches the batch size or the flush
 * interval has elapsed, whichever comes first.
 *
 * The interval is checked both on each event and on the channel's idle
 * timeout, so a partial buffer never waits much longer than one interval.
 * Empty buffers are never flushed. On halt the partial buffer is discarded.
 *
 * Not thread-safe; driven by the channel's single consumer thread.
 *
 * @param <T> event type
 */
public class BatchAccumulator<T> implements EventHandler<EventChannel.Slot<T>>, TimeoutHandler, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(BatchAccumulator.class);

    private final String stream;
    private final int maxBatchSize;
    private final long flushIntervalNanos;
    private final BatchProcessor<T> processor;
    private final PipelineMetrics metrics;
    private final Timer batchTimer;
    private final LongSupplier nanoClock;

    private final List<T> buffer;
    private long lastFlushNanos;

    public BatchAccumulator(String stream, int maxBatchSize, Duration flushInterval,
                            BatchProcessor<T> processor, PipelineMetrics metrics) {
        this(stream, maxBatchSize, flushInterval, processor, metrics, System::nanoTime);
    }

    public BatchAccumulator(String stream, int maxBatchSize, Duration flushInterval,
                            BatchProcessor<T> processor, PipelineMetrics metrics, LongSupplier nanoClock) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + maxBatchSize);
        }
        this.stream = stream;
        this.maxBatchSize = maxBatchSize;
        this.flushIntervalNanos = flushInterval.toNanos();
        this.processor = processor;
        this.metrics = metrics;
        this.batchTimer = metrics.batchTimer(stream);
        this.nanoClock = nanoClock;
        this.buffer = new ArrayList<>(maxBatchSize);
        this.lastFlushNanos = nanoClock.getAsLong();
    }

    @Override
    public void onEvent(EventChannel.Slot<T> slot, long sequence, boolean endOfBatch) {
        T event = slot.take();
        if (event == null) {
            return;
        }
        buffer.add(event);

        if (buffer.size() >= maxBatchSize || intervalElapsed()) {
            flush();
        }
    }

    @Override
    public void onTimeout(long sequence) {
        // Idle for a full interval; anything buffered is at least that old
        flush();
    }

    @Override
    public void onStart() {
        lastFlushNanos = nanoClock.getAsLong();
        log.info("Batch accumulator started: stream={}, batchSize={}, flushInterval={}ns",
                stream, maxBatchSize, flushIntervalNanos);
    }

    @Override
    public void onShutdown() {
        if (!buffer.isEmpty()) {
            log.warn("Discarding {} unflushed {} events on shutdown", buffer.size(), stream);
            buffer.clear();
        }
        log.info("Batch accumulator stopped: stream={}", stream);
    }

    /**
     * Runs the processor over the buffered events. A failing processor is
     * logged and counted; the buffer is cleared either way.
     */
    void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<T> batch = new ArrayList<>(buffer);
        Timer.Sample sample = Timer.start();
        try {
            processor.process(batch);
            metrics.batchFlushed(stream);
        } catch (RuntimeException e) {
            metrics.batchFailed();
            log.error("Batch processing failed: stream={}, size={}", stream, batch.size(), e);
        } finally {
            sample.stop(batchTimer);
            buffer.clear();
            lastFlushNanos = nanoClock.getAsLong();
        }

        if (log.isTraceEnabled()) {
            log.trace("Flushed batch: stream={}, size={}", stream, batch.size());
        }
    }

    private boolean intervalElapsed() {
        return nanoClock.getAsLong() - lastFlushNanos >= flushIntervalNanos;
    }

    /** Returns the number of buffered, not yet flushed events. */
    int pending() {
        return buffer.size();
    }

    public String getStream() {
        return stream;
    }
}
