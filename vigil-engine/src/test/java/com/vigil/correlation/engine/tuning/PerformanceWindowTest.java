package com.vigil.correlation.engine.tuning;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerformanceWindowTest {

    @Test
    void averageShouldBeSeededWithFirstSampleThenSmoothed() {
        PerformanceWindow window = new PerformanceWindow(1000, 10, 0.1);

        window.record(100);
        assertThat(window.average()).isEqualTo(100.0);

        window.record(200);
        assertThat(window.average()).isCloseTo(110.0, within(1e-9));
    }

    @Test
    void p99ShouldRequireMinimumSamples() {
        PerformanceWindow window = new PerformanceWindow(1000, 10, 0.1);
        for (int i = 1; i <= 9; i++) {
            window.record(i);
        }
        assertThat(window.p99()).isZero();

        window.record(10);
        assertThat(window.p99()).isEqualTo(10.0);
    }

    @Test
    void p99ShouldUseFloorIndexOverSortedSamples() {
        PerformanceWindow window = new PerformanceWindow(1000, 10, 0.1);
        for (int i = 200; i >= 1; i--) {
            window.record(i);
        }

        // floor(200 * 0.99) = 198 -> 199th smallest
        assertThat(window.p99()).isEqualTo(199.0);
        assertThat(window.sampleCount()).isEqualTo(200);
    }

    @Test
    void ringShouldKeepOnlyMostRecentSamples() {
        PerformanceWindow window = new PerformanceWindow(10, 1, 0.1);
        for (int i = 0; i < 10; i++) {
            window.record(1_000);
        }
        for (int i = 0; i < 10; i++) {
            window.record(5);
        }

        assertThat(window.sampleCount()).isEqualTo(10);
        assertThat(window.p99()).isEqualTo(5.0);
    }
}
