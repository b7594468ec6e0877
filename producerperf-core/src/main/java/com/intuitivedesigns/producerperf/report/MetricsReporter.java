/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.report;

import com.intuitivedesigns.producerperf.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.producerperf.metrics.ProducerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic stats line on stdout while a run is in progress.
 *
 * <p>A tick whose instruments are not all registered prints nothing. {@link #printFinal()} always
 * prints, falling back to zeroes.
 */
public final class MetricsReporter {

    private static final Logger log = LoggerFactory.getLogger(MetricsReporter.class);

    private final ProducerMetrics metrics;
    private final int messageSize;
    private final PrintStream out;
    private final Duration interval;

    private ScheduledExecutorService scheduler;

    public MetricsReporter(ProducerMetrics metrics, int messageSize, PrintStream out, Duration interval) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.out = Objects.requireNonNull(out, "out");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.messageSize = messageSize;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("perf-reporter"));
        final long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        try {
            printIfAvailable();
        } catch (RuntimeException e) {
            // a failing tick must not cancel the schedule
            log.warn("Metrics report failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} if a line was printed
     */
    public boolean printIfAvailable() {
        final Optional<MetricsSnapshot> snapshot = MetricsSnapshot.capture(metrics);
        if (snapshot.isEmpty()) {
            log.debug("Skipping report: producer metrics not registered yet");
            return false;
        }
        out.println(snapshot.get().format(messageSize));
        return true;
    }

    public void printFinal() {
        out.println(MetricsSnapshot.capture(metrics).orElseGet(MetricsSnapshot::empty).format(messageSize));
    }

    /**
     * Stops the schedule and waits for an in-progress tick, so no periodic line can follow the
     * final one.
     */
    public synchronized void stop() throws InterruptedException {
        if (scheduler == null) return;
        scheduler.shutdown();
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Metrics reporter did not stop within 5s");
        }
        scheduler = null;
    }
}
