/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.errors;

/**
 * Root of every fatal benchmark failure.
 *
 * <p>Each subtype carries the process exit status the entry point should use, so the core can
 * propagate failures instead of terminating the JVM itself.
 */
public abstract class BenchmarkException extends RuntimeException {

    /** Bad invocation: the run was rejected before any work started. */
    public static final int EXIT_USAGE = 64;

    /** A failure while generating or delivering load. */
    public static final int EXIT_UNAVAILABLE = 69;

    protected BenchmarkException(String message) {
        super(message);
    }

    protected BenchmarkException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int exitStatus();
}
