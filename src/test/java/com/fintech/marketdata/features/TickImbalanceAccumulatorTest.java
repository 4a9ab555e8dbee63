package com.fintech.marketdata.features;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("TickImbalanceAccumulator Tests")
class TickImbalanceAccumulatorTest {

    @ParameterizedTest(name = "new={0}, previous={1} -> {2}")
    @CsvSource({"101.0, 100.0, 1", "99.0, 100.0, -1", "100.0, 100.0, 0", "50.0, 0.0, 1"})
    @DisplayName("Should derive tick sign from price move")
    void testSign(double newPrice, double previous, int expected) {
        assertThat(TickImbalanceAccumulator.sign(newPrice, previous)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should return zero ratio when empty")
    void testEmpty() {
        TickImbalanceAccumulator ticks = new TickImbalanceAccumulator(50);

        assertThat(ticks.ratio()).isZero();
        assertThat(ticks.lastSign()).isZero();
    }

    @Test
    @DisplayName("Should average signs over the window")
    void testRatio() {
        TickImbalanceAccumulator ticks = new TickImbalanceAccumulator(50);
        ticks.add(1);
        ticks.add(1);
        ticks.add(-1);
        ticks.add(0);

        assertThat(ticks.ratio()).isCloseTo(0.25, within(1e-12));
        assertThat(ticks.lastSign()).isZero();
    }

    @Test
    @DisplayName("Should evict the oldest sign once full")
    void testEviction() {
        TickImbalanceAccumulator ticks = new TickImbalanceAccumulator(3);
        ticks.add(-1);
        ticks.add(1);
        ticks.add(1);
        ticks.add(1);

        assertThat(ticks.size()).isEqualTo(3);
        assertThat(ticks.ratio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject signs outside -1..1")
    void testInvalidSign() {
        TickImbalanceAccumulator ticks = new TickImbalanceAccumulator(3);

        assertThatThrownBy(() -> ticks.add(2)).isInstanceOf(IllegalArgumentException.class);
    }
}
