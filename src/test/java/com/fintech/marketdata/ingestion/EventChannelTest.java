package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.domain.Trade;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventChannel Tests")
class EventChannelTest {

    private EventChannel<Trade> channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.halt();
        }
    }

    @ParameterizedTest(name = "capacity={0}")
    @ValueSource(ints = {0, 3, 100, -8})
    @DisplayName("Should reject capacities that are not a power of two")
    void testInvalidCapacity(int capacity) {
        assertThatThrownBy(() -> new EventChannel<Trade>("trades", capacity, Duration.ofMillis(1), "TIMEOUT_BLOCKING"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should refuse publishing before start")
    void testPublishBeforeStart() {
        channel = new EventChannel<>("trades", 8, Duration.ofMillis(1), "TIMEOUT_BLOCKING");

        assertThatThrownBy(() -> channel.publish(trade(1))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> channel.tryPublish(trade(1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should deliver events to the consumer in publish order")
    void testDeliveryOrder() throws InterruptedException {
        List<Double> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(20);
        channel = new EventChannel<>("trades", 8, Duration.ofMillis(5), "LITE_TIMEOUT_BLOCKING");
        channel.start((slot, sequence, endOfBatch) -> {
            received.add(slot.take().price());
            latch.countDown();
        });

        for (int i = 0; i < 20; i++) {
            assertThat(channel.publish(trade(i))).isTrue();
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(received.get(i)).isEqualTo((double) i);
        }
    }

    @Test
    @DisplayName("Should refuse to start twice")
    void testDoubleStart() {
        channel = new EventChannel<>("trades", 8, Duration.ofMillis(1), "TIMEOUT_BLOCKING");
        channel.start((slot, sequence, endOfBatch) -> slot.take());

        assertThatThrownBy(() -> channel.start((slot, sequence, endOfBatch) -> slot.take()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject events after halt and let the consumer exit")
    void testPublishAfterHalt() throws InterruptedException {
        channel = new EventChannel<>("trades", 8, Duration.ofMillis(1), "TIMEOUT_BLOCKING");
        channel.start((slot, sequence, endOfBatch) -> slot.take());

        channel.halt();
        channel.halt();

        assertThat(channel.isHalted()).isTrue();
        assertThat(channel.publish(trade(1))).isFalse();
        assertThat(channel.tryPublish(trade(1))).isFalse();
        assertThat(channel.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should fail fast with tryPublish when the ring is full")
    void testTryPublishWhenFull() {
        CountDownLatch release = new CountDownLatch(1);
        channel = new EventChannel<>("trades", 2, Duration.ofMillis(1), "TIMEOUT_BLOCKING");
        channel.start((slot, sequence, endOfBatch) -> {
            slot.take();
            release.await();
        });

        try {
            channel.publish(trade(1));
            channel.publish(trade(2));

            assertThat(channel.tryPublish(trade(3))).isFalse();
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Should unblock a producer waiting on a full ring when halted")
    void testBlockedProducerReleasedByHalt() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        channel = new EventChannel<>("trades", 2, Duration.ofMillis(1), "TIMEOUT_BLOCKING");
        channel.start((slot, sequence, endOfBatch) -> {
            slot.take();
            release.await();
        });

        try {
            channel.publish(trade(1));
            channel.publish(trade(2));

            CountDownLatch returned = new CountDownLatch(1);
            AtomicBoolean result = new AtomicBoolean(true);
            Thread producer = new Thread(() -> {
                result.set(channel.publish(trade(3)));
                returned.countDown();
            });
            producer.start();

            channel.halt();

            assertThat(returned.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(result.get()).isFalse();
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Should report the configured capacity before start")
    void testCapacity() {
        channel = new EventChannel<>("depths", 64, Duration.ofMillis(1), "UNKNOWN");

        assertThat(channel.getCapacity()).isEqualTo(64);
        assertThat(channel.getRemainingCapacity()).isEqualTo(64);
        assertThat(channel.getName()).isEqualTo("depths");
    }

    private static Trade trade(int i) {
        return new Trade("BTCUSDT", i, 1.0, Instant.ofEpochSecond(1_700_000_000L, i));
    }
}
