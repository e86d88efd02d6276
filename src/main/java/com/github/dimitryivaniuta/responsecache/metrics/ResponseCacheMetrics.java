package com.github.dimitryivaniuta.responsecache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class ResponseCacheMetrics {

    public static final String OPERATION_READ = "read";
    public static final String OPERATION_WRITE = "write";

    private final MeterRegistry registry;

    public ResponseCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Lookup outcome ----
    public void hit() {
        Counter.builder("response_cache_hits_total")
                .register(registry)
                .increment();
    }

    public void miss() {
        Counter.builder("response_cache_misses_total")
                .register(registry)
                .increment();
    }

    public void bypassed(String reason) {
        Counter.builder("response_cache_bypassed_total")
                .tag("reason", reason) // disabled | route
                .register(registry)
                .increment();
    }

    // ---- Store ----
    public void storeFailure(String operation) {
        Counter.builder("response_cache_store_failures_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
