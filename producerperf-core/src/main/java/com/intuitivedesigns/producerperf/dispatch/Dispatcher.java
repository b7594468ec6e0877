/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.dispatch;

/**
 * Drives generated messages through a producer client until the whole load is delivered.
 *
 * <p>There is no mid-run cancellation: {@link #dispatch()} returns once every message is
 * acknowledged, or throws on the first failure.
 */
public interface Dispatcher {

    /**
     * @throws com.intuitivedesigns.producerperf.errors.BenchmarkException on the first
     *         generation or delivery failure
     */
    DispatchResult dispatch() throws InterruptedException;
}
