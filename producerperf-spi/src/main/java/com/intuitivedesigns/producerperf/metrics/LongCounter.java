/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import java.util.concurrent.atomic.LongAdder;

/**
 * Up/down counter (e.g. requests currently in flight).
 */
public final class LongCounter {

    private final LongAdder value = new LongAdder();

    public void increment() {
        value.increment();
    }

    public void decrement() {
        value.decrement();
    }

    public long count() {
        return value.sum();
    }
}
