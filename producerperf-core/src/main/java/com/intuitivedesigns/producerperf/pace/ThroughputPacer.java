/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.pace;

import com.intuitivedesigns.producerperf.concurrent.NamedDaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort cap on messages emitted per window.
 *
 * <p>A timer offers one tick per window into a single-slot holder; a tick that arrives while
 * the slot is occupied is dropped. After every {@code throughput}-th emitted message the caller
 * blocks until a tick is available. There is no catch-up after a stall and no guarantee of exact
 * spacing, only that steady-state emission does not exceed roughly {@code throughput} per window.
 *
 * <p>Not thread-safe: each sender owns its own pacer.
 */
public final class ThroughputPacer implements AutoCloseable {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(1);

    private static final ThroughputPacer UNBOUNDED = new ThroughputPacer();

    private final int throughput;
    private final BlockingQueue<Boolean> tick;
    private final ScheduledExecutorService timer;
    private long emitted;

    private ThroughputPacer() {
        this.throughput = 0;
        this.tick = null;
        this.timer = null;
    }

    private ThroughputPacer(int throughput, Duration window) {
        this.throughput = throughput;
        this.tick = new ArrayBlockingQueue<>(1);
        this.timer = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("perf-pacer"));

        final long periodNs = window.toNanos();
        timer.scheduleAtFixedRate(() -> tick.offer(Boolean.TRUE), periodNs, periodNs, TimeUnit.NANOSECONDS);
    }

    /**
     * Starts a pacer. A throughput of 0 disables pacing and starts no timer.
     */
    public static ThroughputPacer start(int throughput, Duration window) {
        Objects.requireNonNull(window, "window");
        if (throughput < 0) throw new IllegalArgumentException("throughput must be >= 0");
        if (throughput == 0) return UNBOUNDED;
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be > 0");
        return new ThroughputPacer(throughput, window);
    }

    public static ThroughputPacer unbounded() {
        return UNBOUNDED;
    }

    public boolean enabled() {
        return throughput > 0;
    }

    public int throughput() {
        return throughput;
    }

    /**
     * Records one emitted message, blocking for the next tick when a full window's quota has
     * been used.
     */
    public void onEmitted() throws InterruptedException {
        if (!enabled()) return;
        emitted++;
        if (emitted % throughput == 0) {
            awaitTick();
        }
    }

    /**
     * Blocks until the next tick. Returns immediately when pacing is disabled.
     */
    public void awaitTick() throws InterruptedException {
        if (!enabled()) return;
        tick.take();
    }

    int pendingTicks() {
        return tick == null ? 0 : tick.size();
    }

    @Override
    public void close() {
        if (timer != null) {
            timer.shutdownNow();
        }
    }
}
