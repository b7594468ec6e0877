/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * Monotonic event counter with a mean rate since creation.
 */
public final class RateMeter {

    private final LongAdder count = new LongAdder();
    private final LongSupplier nanoClock;
    private final long startNanos;

    public RateMeter() {
        this(System::nanoTime);
    }

    public RateMeter(LongSupplier nanoClock) {
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.startNanos = nanoClock.getAsLong();
    }

    public void mark() {
        count.increment();
    }

    public void mark(long n) {
        if (n > 0) count.add(n);
    }

    public long count() {
        return count.sum();
    }

    /**
     * Events per second averaged over the meter's whole lifetime.
     */
    public double meanRate() {
        final long elapsedNs = nanoClock.getAsLong() - startNanos;
        if (elapsedNs <= 0) return 0.0;
        return count.sum() / (elapsedNs / 1_000_000_000.0);
    }
}
