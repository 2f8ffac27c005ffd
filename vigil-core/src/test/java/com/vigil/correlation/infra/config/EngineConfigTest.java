package com.vigil.correlation.infra.config;

import com.vigil.correlation.api.model.RuntimeConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.circuitBreakerThreshold()).isEqualTo(5);
        assertThat(config.circuitBreakerTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.highPriorityPool().concurrency()).isEqualTo(20);
        assertThat(config.highPriorityPool().timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.highPriorityPool().startsPerSecond()).isEqualTo(2000.0);
        assertThat(config.normalPriorityPool().concurrency()).isEqualTo(50);
        assertThat(config.normalPriorityPool().timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.ruleCacheTtl()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.bufferRetention()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.batchMaxDelay()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.tunerInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.performanceWindowSize()).isEqualTo(1000);
        assertThat(config.initialRuntime()).isEqualTo(RuntimeConfig.defaults());
    }

    @Test
    void shouldLoadPropertiesFromClasspath() {
        EngineConfig config = EngineConfig.loadFromProperties("correlation-test.properties");

        assertThat(config.circuitBreakerThreshold()).isEqualTo(7);
        assertThat(config.circuitBreakerTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.highPriorityPool().concurrency()).isEqualTo(4);
        assertThat(config.ruleCacheTtl()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.initialRuntime().batchSize()).isEqualTo(80);
        assertThat(config.initialRuntime().streamProcessingMode()).isTrue();
    }

    @Test
    void missingFileShouldFallBackToDefaults() {
        EngineConfig config = EngineConfig.loadFromProperties("does-not-exist.properties");

        assertThat(config.circuitBreakerThreshold()).isEqualTo(5);
    }

    @Test
    void environmentShouldOverrideProperties() {
        Properties props = new Properties();
        props.setProperty("correlation.circuit.threshold", "7");
        props.setProperty("correlation.runtime.max.concurrent.events", "500");

        EngineConfig config = EngineConfig.fromSources(props, Map.of(
                "CORRELATION_CIRCUIT_THRESHOLD", "9",
                "CORRELATION_RUNTIME_FAST_PATH_ENABLED", "false"));

        assertThat(config.circuitBreakerThreshold()).isEqualTo(9);
        assertThat(config.initialRuntime().maxConcurrentEvents()).isEqualTo(500);
        assertThat(config.initialRuntime().fastPathEnabled()).isFalse();
    }

    @Test
    void shouldNameOffendingPropertyOnParseFailure() {
        Properties props = new Properties();
        props.setProperty("correlation.sequential.cap", "twenty");

        assertThatThrownBy(() -> EngineConfig.fromSources(props, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlation.sequential.cap");
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> EngineConfig.builder().circuitBreaker(0, Duration.ofSeconds(1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("circuitBreakerThreshold");

        assertThatThrownBy(() -> EngineConfig.builder().bufferTrim(10, 50).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bufferTrimCap");
    }

    @Test
    void envNameShouldFollowPropertyKey() {
        assertThat(EngineConfig.envName("correlation.pool.high.timeout.ms"))
                .isEqualTo("CORRELATION_POOL_HIGH_TIMEOUT_MS");
    }
}
