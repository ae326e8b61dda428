package com.github.dimitryivaniuta.memoize.proxy.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MemoizeMetrics {

    private final MeterRegistry registry;

    public MemoizeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics kept in a private registry, for wrappers built outside a Spring context.
     */
    public static MemoizeMetrics detached() {
        return new MemoizeMetrics(new SimpleMeterRegistry());
    }

    public void hit(String store, String methodKey) {
        counter("memoize_hits_total", store, methodKey).increment();
    }

    public void miss(String store, String methodKey) {
        counter("memoize_misses_total", store, methodKey).increment();
    }

    // key function returned the do-not-cache marker
    public void bypass(String store, String methodKey) {
        counter("memoize_bypass_total", store, methodKey).increment();
    }

    // computation returned the do-not-cache marker
    public void storeSkipped(String store, String methodKey) {
        counter("memoize_store_skipped_total", store, methodKey).increment();
    }

    public void evicted(String store, String methodKey, String kind) {
        Counter.builder("memoize_evictions_total")
                .tag("store", store)
                .tag("method", methodKey)
                .tag("kind", kind) // delete | clear
                .register(registry)
                .increment();
    }

    private Counter counter(String name, String store, String methodKey) {
        return Counter.builder(name)
                .tag("store", store) // backend | context
                .tag("method", methodKey)
                .register(registry);
    }
}
