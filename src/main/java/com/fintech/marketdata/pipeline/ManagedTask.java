package com.fintech.marketdata.pipeline;

import java.util.concurrent.TimeUnit;

/**
 * A long-running pipeline task that can be cancelled and awaited.
 */
public interface ManagedTask {

    String taskName();

    /** Signals the task to stop at its next wait point. Must not block. */
    void cancel();

    /**
     * Waits for the task to finish after {@link #cancel()}.
     *
     * @return true if it finished within the timeout
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    static ManagedTask of(String name, Runnable cancel, Awaiter awaiter) {
        return new ManagedTask() {
            @Override
            public String taskName() {
                return name;
            }

            @Override
            public void cancel() {
                cancel.run();
            }

            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
                return awaiter.await(timeout, unit);
            }
        };
    }

    @FunctionalInterface
    interface Awaiter {
        boolean await(long timeout, TimeUnit unit) throws InterruptedException;
    }
}
