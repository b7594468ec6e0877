/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.errors;

/**
 * Invalid or missing settings, unreadable message files, empty record pools.
 * Always raised before any message is dispatched.
 */
public class ConfigurationException extends BenchmarkException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitStatus() {
        return EXIT_USAGE;
    }
}
