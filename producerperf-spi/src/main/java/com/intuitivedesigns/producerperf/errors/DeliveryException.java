/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.errors;

/**
 * The producer client could not deliver a record, report a completion, or shut down.
 * A benchmark run that hits one of these is void; there is no retry.
 */
public class DeliveryException extends BenchmarkException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitStatus() {
        return EXIT_UNAVAILABLE;
    }
}
