package com.vigil.correlation.infra.metrics.impl.prometheus;


import com.vigil.correlation.infra.metrics.MetricsRegistry;
import com.vigil.correlation.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider, registered via
 * {@code META-INF/services/com.vigil.correlation.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;  // Prefer Prometheus in production
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
