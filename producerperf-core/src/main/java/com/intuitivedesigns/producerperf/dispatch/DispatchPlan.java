/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Split of a message load across sync workers.
 *
 * <p>Every worker gets {@code load / workers}; the last one also takes {@code load % workers}.
 */
public record DispatchPlan(int load, int workers) {

    public DispatchPlan {
        if (workers < 1 || workers > load) {
            throw new IllegalArgumentException("workers must be in [1, " + load + "], got " + workers);
        }
    }

    public int chunkSize(int worker) {
        if (worker < 0 || worker >= workers) {
            throw new IndexOutOfBoundsException("worker " + worker + " of " + workers);
        }
        final int base = load / workers;
        return worker == workers - 1 ? base + load % workers : base;
    }

    public List<Integer> chunks() {
        final List<Integer> out = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            out.add(chunkSize(i));
        }
        return Collections.unmodifiableList(out);
    }
}
