/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Metrics runtime over a Micrometer composite registry.
 *
 * Features:
 * - Composite Registry, so exporters attached to it see every producer meter
 * - In-memory SimpleMeterRegistry always present, so meters are readable without an exporter
 * - Common tags from {@code metrics.tag.*}
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;

    public MicrometerMetricsRuntime() {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());
    }

    public static MicrometerMetricsRuntime fromSettings(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");
        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();
        runtime.registry.config().commonTags(settings.tags());
        log.info("Metrics runtime initialized (type=MICROMETER, tags={})", settings.commonTags());
        return runtime;
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void close() {
        registry.close();
        log.debug("Metrics runtime closed.");
    }
}
