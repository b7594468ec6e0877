/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.core.OutboundMessage;

import java.util.Objects;

/**
 * How many messages one generator stream emits, and where they go.
 */
public record GenerationJob(int count, String topic, int partition) {

    public GenerationJob {
        Objects.requireNonNull(topic, "topic");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got " + count);
        }
        if (partition < OutboundMessage.ANY_PARTITION) {
            throw new IllegalArgumentException("partition must be >= -1, got " + partition);
        }
    }
}
