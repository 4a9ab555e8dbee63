package com.fintech.marketdata.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative shutdown of the pipeline tasks.
 *
 * Cancels every registered task at once, then waits for them one by one
 * against a single shared deadline. Tasks still running at the deadline are
 * logged and abandoned. Only the first call does any work.
 */
public class ShutdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final Duration drainTimeout;
    private final List<ManagedTask> tasks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public ShutdownCoordinator(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public void register(ManagedTask task) {
        if (shutdown.get()) {
            throw new IllegalStateException("Shutdown already in progress, cannot register " + task.taskName());
        }
        tasks.add(task);
    }

    /**
     * Cancels all tasks and waits for them up to the drain timeout in total.
     *
     * @return true if every task finished in time (also on repeated calls)
     */
    public boolean shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return true;
        }

        log.info("Shutting down {} pipeline tasks (drain timeout {})", tasks.size(), drainTimeout);
        for (ManagedTask task : tasks) {
            try {
                task.cancel();
            } catch (RuntimeException e) {
                log.error("Failed to cancel task {}", task.taskName(), e);
            }
        }

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        List<String> unfinished = new ArrayList<>();
        for (ManagedTask task : tasks) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                if (!task.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    unfinished.add(task.taskName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining pipeline tasks");
                unfinished.add(task.taskName());
                break;
            }
        }

        if (!unfinished.isEmpty()) {
            log.warn("Shutdown timeout after {}: tasks still running {}", drainTimeout, unfinished);
            return false;
        }
        log.info("All pipeline tasks stopped");
        return true;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }
}
