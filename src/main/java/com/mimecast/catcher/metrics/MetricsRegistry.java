package com.mimecast.catcher.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

/**
 * Global access to the metric registry.
 *
 * <p>Defaults to the Micrometer global composite registry which records nothing until a registry is added to it.
 */
public final class MetricsRegistry {
    private static volatile MeterRegistry registry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the metric registry.
     *
     * @param meterRegistry Registry or null to fall back to the global one.
     */
    public static void register(MeterRegistry meterRegistry) {
        registry = meterRegistry;
    }

    /**
     * Get the registry.
     *
     * @return MeterRegistry instance.
     */
    public static MeterRegistry getRegistry() {
        MeterRegistry current = registry;
        return current != null ? current : Metrics.globalRegistry;
    }
}
