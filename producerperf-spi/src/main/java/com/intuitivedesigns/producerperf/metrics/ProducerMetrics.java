/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named instruments maintained by a producer client.
 *
 * <p>Instruments are created on first use by the client. Readers look them up with the
 * {@code find*} methods, which return empty until the client has registered the name. Every
 * instrument is also bound into the optional Micrometer registry under
 * {@code producerperf.<name>} so exporters see the same numbers.
 */
public final class ProducerMetrics {

    public static final String RECORD_SEND_RATE = "record-send-rate";
    public static final String REQUEST_LATENCY = "request-latency-in-ms";
    public static final String OUTGOING_BYTE_RATE = "outgoing-byte-rate";
    public static final String REQUESTS_IN_FLIGHT = "requests-in-flight";

    private static final String MICROMETER_PREFIX = "producerperf.";

    private final MeterRegistry registry;

    private final ConcurrentMap<String, RateMeter> meters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LatencyHistogram> histograms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();

    public ProducerMetrics() {
        this(null);
    }

    /**
     * @param registry Micrometer registry to mirror instruments into, or {@code null}
     */
    public ProducerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Writers (client side) ---

    public RateMeter meter(String name) {
        return meters.computeIfAbsent(name, key -> {
            final RateMeter meter = new RateMeter();
            if (registry != null) {
                FunctionCounter.builder(micrometerName(key), meter, RateMeter::count)
                        .description("Cumulative count behind " + key)
                        .register(registry);
            }
            return meter;
        });
    }

    public LatencyHistogram histogram(String name) {
        return histograms.computeIfAbsent(name, key -> {
            final LatencyHistogram histogram = new LatencyHistogram();
            if (registry != null) {
                Gauge.builder(micrometerName(key) + ".mean", histogram, h -> h.snapshot().mean())
                        .baseUnit("milliseconds")
                        .register(registry);
                FunctionCounter.builder(micrometerName(key) + ".count", histogram, LatencyHistogram::count)
                        .register(registry);
            }
            return histogram;
        });
    }

    public LongCounter counter(String name) {
        return counters.computeIfAbsent(name, key -> {
            final LongCounter counter = new LongCounter();
            if (registry != null) {
                Gauge.builder(micrometerName(key), counter, LongCounter::count).register(registry);
            }
            return counter;
        });
    }

    // --- Readers (reporter side) ---

    public Optional<RateMeter> findMeter(String name) {
        return Optional.ofNullable(meters.get(name));
    }

    public Optional<LatencyHistogram> findHistogram(String name) {
        return Optional.ofNullable(histograms.get(name));
    }

    public Optional<LongCounter> findCounter(String name) {
        return Optional.ofNullable(counters.get(name));
    }

    private static String micrometerName(String name) {
        return MICROMETER_PREFIX + name.replace('-', '.');
    }
}
