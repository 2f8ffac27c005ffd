package com.vigil.correlation.engine.admission;

import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;
import com.vigil.correlation.engine.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.EPOCH);
        breaker = new CircuitBreaker(5, Duration.ofMillis(30_000), clock);
    }

    @Test
    void shouldOpenAfterThresholdAndCloseAfterTimeout() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }

        clock.set(Instant.ofEpochMilli(1000));
        assertThat(breaker.isOpen()).isTrue();

        clock.set(Instant.ofEpochMilli(30_001));
        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.failures()).isZero();
    }

    @Test
    void shouldStayClosedBelowThreshold() {
        for (int i = 0; i < 4; i++) {
            breaker.recordFailure();
        }

        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.failures()).isEqualTo(4);
    }

    @Test
    void successShouldDecrementWithFloorOfZero() {
        breaker.recordFailure();
        breaker.recordFailure();

        breaker.recordSuccess();
        assertThat(breaker.failures()).isEqualTo(1);

        breaker.recordSuccess();
        breaker.recordSuccess();
        assertThat(breaker.failures()).isZero();
    }

    @Test
    void slowEventsCountWithoutMovingFailureTime() {
        clock.set(Instant.ofEpochMilli(100_000));
        for (int i = 0; i < 5; i++) {
            breaker.recordSlow();
        }

        // last failure time is still the epoch, so the breaker is past its timeout
        assertThat(breaker.failures()).isEqualTo(5);
        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.failures()).isZero();
    }

    @Test
    void snapshotShouldNotResetFailures() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
        clock.advanceMillis(60_000);

        assertThat(breaker.snapshot().open()).isFalse();
        assertThat(breaker.snapshot().failures()).isEqualTo(5);
        assertThat(breaker.snapshot().status()).isEqualTo("closed");
    }

    @Test
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new CircuitBreaker(0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void admissionShouldRejectWhenOpenOrOverloaded() {
        int[] inFlight = {0};
        AdmissionController admission = new AdmissionController(breaker, () -> inFlight[0]);
        RuntimeConfig config = RuntimeConfig.defaults();

        assertThat(admission.admit(config)).isEqualTo(AdmissionController.Decision.ADMITTED);

        inFlight[0] = 1001;
        assertThat(admission.admit(config)).isEqualTo(AdmissionController.Decision.OVERLOAD);

        inFlight[0] = 1000;
        assertThat(admission.admit(config)).isEqualTo(AdmissionController.Decision.ADMITTED);

        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
        assertThat(admission.admit(config)).isEqualTo(AdmissionController.Decision.CIRCUIT_OPEN);
    }

    @Test
    void admissionShouldIgnoreBreakerWhenDisabled() {
        AdmissionController admission = new AdmissionController(breaker, () -> 0);
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
        RuntimeConfig config = RuntimeConfig.defaults()
                .merge(RuntimeConfigPatch.builder().enableCircuitBreaker(false).build());

        assertThat(admission.admit(config)).isEqualTo(AdmissionController.Decision.ADMITTED);
    }
}
