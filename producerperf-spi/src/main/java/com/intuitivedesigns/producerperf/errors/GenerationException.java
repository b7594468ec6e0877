/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.errors;

public class GenerationException extends BenchmarkException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitStatus() {
        return EXIT_UNAVAILABLE;
    }
}
