/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.report;

import com.intuitivedesigns.producerperf.metrics.LatencyHistogram;
import com.intuitivedesigns.producerperf.metrics.LongCounter;
import com.intuitivedesigns.producerperf.metrics.ProducerMetrics;
import com.intuitivedesigns.producerperf.metrics.RateMeter;

import java.util.Locale;
import java.util.Optional;

/**
 * Point-in-time read of the four instruments the report line is built from.
 */
public record MetricsSnapshot(long recordsSent,
                              double recordsPerSecond,
                              double egressBytesPerSecond,
                              double latencyMeanMs,
                              double latencyStdDevMs,
                              double latencyP50Ms,
                              double latencyP75Ms,
                              double latencyP95Ms,
                              double latencyP99Ms,
                              double latencyP999Ms,
                              long requestsInFlight) {

    private static final double MIB = 1024.0 * 1024.0;

    private static final String LINE_FORMAT =
            "%d records sent, %.1f records/sec (%.2f MiB/sec ingress, %.2f MiB/sec egress), "
                    + "%.1f ms avg latency, %.1f ms stddev, %.1f ms 50th, %.1f ms 75th, "
                    + "%.1f ms 95th, %.1f ms 99th, %.1f ms 99.9th, %d total req. in flight";

    /**
     * Reads the named instruments. Empty if any of them has not been registered yet.
     */
    public static Optional<MetricsSnapshot> capture(ProducerMetrics metrics) {
        final Optional<RateMeter> sendRate = metrics.findMeter(ProducerMetrics.RECORD_SEND_RATE);
        final Optional<LatencyHistogram> latency = metrics.findHistogram(ProducerMetrics.REQUEST_LATENCY);
        final Optional<RateMeter> byteRate = metrics.findMeter(ProducerMetrics.OUTGOING_BYTE_RATE);
        final Optional<LongCounter> inFlight = metrics.findCounter(ProducerMetrics.REQUESTS_IN_FLIGHT);

        if (sendRate.isEmpty() || latency.isEmpty() || byteRate.isEmpty() || inFlight.isEmpty()) {
            return Optional.empty();
        }

        final LatencyHistogram.LatencySnapshot l = latency.get().snapshot();
        final double[] q = l.quantiles(0.5, 0.75, 0.95, 0.99, 0.999);
        return Optional.of(new MetricsSnapshot(
                sendRate.get().count(),
                sendRate.get().meanRate(),
                byteRate.get().meanRate(),
                l.mean(),
                l.stdDev(),
                q[0], q[1], q[2], q[3], q[4],
                inFlight.get().count()));
    }

    /** All-zero snapshot, used for the closing line when the client never registered its instruments. */
    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Ingress is derived from the configured message size, not from observed payloads, so
     * file-backed runs report it relative to {@code messageSize} as well.
     */
    public double ingressMiBPerSecond(int messageSize) {
        return recordsPerSecond * messageSize / MIB;
    }

    public double egressMiBPerSecond() {
        return egressBytesPerSecond / MIB;
    }

    public String format(int messageSize) {
        return String.format(Locale.US, LINE_FORMAT,
                recordsSent,
                recordsPerSecond,
                ingressMiBPerSecond(messageSize),
                egressMiBPerSecond(),
                latencyMeanMs,
                latencyStdDevMs,
                latencyP50Ms,
                latencyP75Ms,
                latencyP95Ms,
                latencyP99Ms,
                latencyP999Ms,
                requestsInFlight);
    }
}
