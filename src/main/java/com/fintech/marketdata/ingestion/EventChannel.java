package com.fintech.marketdata.ingestion;

import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.LiteTimeoutBlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutBlockingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Bounded single-consumer channel backed by an LMAX Disruptor ring buffer.
 *
 * Producers block while the ring is full but give up once the channel is
 * halted or the producing thread is interrupted. The consumer runs on its own
 * thread and wakes at least once per timeout so handlers implementing
 * {@link com.lmax.disruptor.TimeoutHandler} can act while the channel is idle.
 *
 * @param <T> event type
 */
public class EventChannel<T> {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    private static final long PUBLISH_BACKOFF_NANOS = TimeUnit.MICROSECONDS.toNanos(50);

    private final String name;
    private final int capacity;
    private final Duration timeout;
    private final String waitStrategyName;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private Disruptor<Slot<T>> disruptor;
    private RingBuffer<Slot<T>> ringBuffer;
    private volatile boolean halted;

    /**
     * @param name channel name, used for the consumer thread and in logs
     * @param capacity ring size, must be a power of two
     * @param timeout idle wake-up interval of the consumer
     * @param waitStrategyName TIMEOUT_BLOCKING or LITE_TIMEOUT_BLOCKING
     */
    public EventChannel(String name, int capacity, Duration timeout, String waitStrategyName) {
        if (Integer.bitCount(capacity) != 1) {
            throw new IllegalArgumentException("Channel capacity must be a power of two: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.timeout = timeout;
        this.waitStrategyName = waitStrategyName;
    }

    /**
     * Starts the consumer thread.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start(EventHandler<Slot<T>> handler) {
        if (disruptor != null) {
            throw new IllegalStateException("Channel already started: " + name);
        }

        EventFactory<Slot<T>> eventFactory = Slot::new;

        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(() -> {
                try {
                    runnable.run();
                } finally {
                    terminated.countDown();
                }
            });
            thread.setName(name + "-consumer");
            thread.setDaemon(false);
            return thread;
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            capacity,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );
        disruptor.handleEventsWith(handler);

        // Last resort: handlers catch their own failures
        disruptor.setDefaultExceptionHandler(new ExceptionHandler<Slot<T>>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, Slot<T> event) {
                log.error("Exception in {} consumer at sequence {}: {}", name, sequence, event.value, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during {} consumer startup", name, ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during {} consumer shutdown", name, ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Channel started: name={}, capacity={}, waitStrategy={}, timeout={}",
                name, capacity, waitStrategy.getClass().getSimpleName(), timeout);
    }

    /**
     * Publishes an event, blocking while the ring is full.
     *
     * @return false if the channel was halted or the caller interrupted before the event was accepted
     */
    public boolean publish(T event) {
        RingBuffer<Slot<T>> ring = requireStarted();
        while (!halted) {
            try {
                long sequence = ring.tryNext();
                try {
                    ring.get(sequence).value = event;
                } finally {
                    ring.publish(sequence);
                }
                return true;
            } catch (InsufficientCapacityException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return false;
                }
                LockSupport.parkNanos(PUBLISH_BACKOFF_NANOS);
            }
        }
        return false;
    }

    /**
     * Publishes without blocking.
     *
     * @return false if the ring is full or the channel halted
     */
    public boolean tryPublish(T event) {
        RingBuffer<Slot<T>> ring = requireStarted();
        if (halted) {
            return false;
        }
        try {
            long sequence = ring.tryNext();
            try {
                ring.get(sequence).value = event;
            } finally {
                ring.publish(sequence);
            }
            return true;
        } catch (InsufficientCapacityException e) {
            return false;
        }
    }

    /**
     * Stops the consumer at its next wait point. Events still in the ring are
     * not delivered. Idempotent.
     */
    public synchronized void halt() {
        if (halted) {
            return;
        }
        halted = true;
        if (disruptor != null) {
            log.info("Halting channel: name={}, pending={}", name, capacity - ringBuffer.remainingCapacity());
            disruptor.halt();
        } else {
            terminated.countDown();
        }
    }

    /**
     * Waits for the consumer thread to exit after {@link #halt()}.
     *
     * @return true if the consumer exited in time
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public boolean isHalted() {
        return halted;
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getRemainingCapacity() {
        return ringBuffer != null ? ringBuffer.remainingCapacity() : capacity;
    }

    private RingBuffer<Slot<T>> requireStarted() {
        RingBuffer<Slot<T>> ring = ringBuffer;
        if (ring == null) {
            throw new IllegalStateException("Channel not started: " + name);
        }
        return ring;
    }

    private WaitStrategy createWaitStrategy() {
        long nanos = timeout.toNanos();
        return switch (waitStrategyName.toUpperCase()) {
            case "TIMEOUT_BLOCKING" -> new TimeoutBlockingWaitStrategy(nanos, TimeUnit.NANOSECONDS);
            case "LITE_TIMEOUT_BLOCKING" -> new LiteTimeoutBlockingWaitStrategy(nanos, TimeUnit.NANOSECONDS);
            default -> {
                log.warn("Unknown wait strategy: {}, using TIMEOUT_BLOCKING", waitStrategyName);
                yield new TimeoutBlockingWaitStrategy(nanos, TimeUnit.NANOSECONDS);
            }
        };
    }

    /**
     * Pre-allocated ring slot.
     */
    public static final class Slot<T> {

        private T value;

        /** Returns the event and clears the slot so the ring holds no reference to it. */
        public T take() {
            T v = value;
            value = null;
            return v;
        }
    }
}
