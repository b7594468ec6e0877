/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.config;

public enum DispatchMode {
    /** Blocking round trip per record, one or more worker threads. */
    SYNC,
    /** Fire-and-collect through the client's completion stream. */
    ASYNC
}
