package com.vigil.correlation.infra.metrics.impl.inmemory;


import com.vigil.correlation.infra.metrics.MetricsRegistry;
import com.vigil.correlation.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for testing.
 *
 * <p>Registered from {@code src/test/resources/META-INF/services} so that it
 * outranks the Prometheus provider only on the test classpath.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;  // Highest priority in test environment
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
