/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;

import java.util.concurrent.TimeUnit;

/**
 * Cumulative latency distribution backed by HdrHistogram.
 *
 * <p>Values are recorded in microseconds and reported in milliseconds. Recording is safe from any
 * thread; {@link #snapshot()} copies the current state so readers never see a half-updated view.
 */
public final class LatencyHistogram {

    private static final int SIGNIFICANT_DIGITS = 3;

    private final ConcurrentHistogram histogram = new ConcurrentHistogram(SIGNIFICANT_DIGITS);

    public void recordNanos(long elapsedNanos) {
        histogram.recordValue(Math.max(0L, TimeUnit.NANOSECONDS.toMicros(elapsedNanos)));
    }

    public void recordMillis(long elapsedMillis) {
        histogram.recordValue(Math.max(0L, TimeUnit.MILLISECONDS.toMicros(elapsedMillis)));
    }

    public long count() {
        return histogram.getTotalCount();
    }

    public LatencySnapshot snapshot() {
        return new LatencySnapshot(histogram.copy());
    }

    /**
     * Point-in-time view of the distribution, in milliseconds.
     */
    public static final class LatencySnapshot {

        private final Histogram copy;

        private LatencySnapshot(Histogram copy) {
            this.copy = copy;
        }

        public long count() {
            return copy.getTotalCount();
        }

        public double mean() {
            return copy.getTotalCount() == 0 ? 0.0 : copy.getMean() / 1000.0;
        }

        public double stdDev() {
            return copy.getTotalCount() == 0 ? 0.0 : copy.getStdDeviation() / 1000.0;
        }

        /**
         * @param quantile in {@code [0, 1]}, e.g. {@code 0.999}
         */
        public double quantile(double quantile) {
            if (copy.getTotalCount() == 0) return 0.0;
            return copy.getValueAtPercentile(quantile * 100.0) / 1000.0;
        }

        public double[] quantiles(double... quantiles) {
            final double[] out = new double[quantiles.length];
            for (int i = 0; i < quantiles.length; i++) {
                out[i] = quantile(quantiles[i]);
            }
            return out;
        }
    }
}
