package com.vigil.correlation.engine.tuning;

import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;
import com.vigil.correlation.engine.config.RuntimeSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveTunerTest {

    private RuntimeSettings settings;
    private PerformanceWindow window;
    private AdaptiveTuner tuner;

    @BeforeEach
    void setUp() {
        settings = new RuntimeSettings(RuntimeConfig.defaults());
        window = new PerformanceWindow(1000, 10, 0.1);
        tuner = new AdaptiveTuner(settings, window, 100, 20, 10);
    }

    private void record(int count, long millis) {
        for (int i = 0; i < count; i++) {
            window.record(millis);
        }
    }

    @Test
    void fastProcessingShouldEnableStreamMode() {
        record(10, 20);

        RuntimeConfigPatch patch = tuner.tune(0, 0);

        assertThat(patch.streamProcessingMode()).isTrue();
        assertThat(settings.current().streamProcessingMode()).isTrue();
    }

    @Test
    void tooFewSamplesShouldNotTriggerLatencyRules() {
        record(5, 20);

        assertThat(tuner.tune(0, 0).isEmpty()).isTrue();
        assertThat(settings.current()).isEqualTo(RuntimeConfig.defaults());
    }

    @Test
    void deepQueueShouldEnableBatchMode() {
        RuntimeConfigPatch patch = tuner.tune(5, 101);

        assertThat(patch.batchProcessingEnabled()).isTrue();
        assertThat(settings.current().batchProcessingEnabled()).isTrue();
    }

    @Test
    void queueAtThresholdShouldNotEnableBatchMode() {
        assertThat(tuner.tune(100, 100).isEmpty()).isTrue();
    }

    @Test
    void slowProcessingShouldShrinkBatchSizeDownToFloor() {
        record(10, 400);

        tuner.tune(0, 0);
        assertThat(settings.current().batchSize()).isEqualTo(40);
        tuner.tune(0, 0);
        tuner.tune(0, 0);
        assertThat(settings.current().batchSize()).isEqualTo(20);

        assertThat(tuner.tune(0, 0).batchSize()).isNull();
        assertThat(settings.current().batchSize()).isEqualTo(20);
    }

    @Test
    void shrinkShouldNotGoBelowFloor() {
        settings.apply(RuntimeConfigPatch.builder().batchSize(25).build());
        record(10, 400);

        tuner.tune(0, 0);

        assertThat(settings.current().batchSize()).isEqualTo(20);
    }

    @Test
    void tunerShouldNeverDisableModes() {
        settings.apply(RuntimeConfigPatch.builder().streamProcessingMode(true).batchProcessingEnabled(true).build());
        record(10, 400);

        RuntimeConfigPatch patch = tuner.tune(0, 0);

        assertThat(patch.streamProcessingMode()).isNull();
        assertThat(patch.batchProcessingEnabled()).isNull();
        assertThat(settings.current().streamProcessingMode()).isTrue();
        assertThat(settings.current().batchProcessingEnabled()).isTrue();
    }
}
