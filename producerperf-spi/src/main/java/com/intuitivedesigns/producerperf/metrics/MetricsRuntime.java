/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Process-wide home for exported metrics.
 *
 * <p>Producer clients mirror their {@link ProducerMetrics} instruments into {@link #registry()};
 * the console reporter does not depend on it.
 */
public interface MetricsRuntime extends AutoCloseable {

    MeterRegistry registry();

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER").
     */
    default String type() { return "NOOP"; }

    @Override
    default void close() {
        // no-op by default
    }
}
