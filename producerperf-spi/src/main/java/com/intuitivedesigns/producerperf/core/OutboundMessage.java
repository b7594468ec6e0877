/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.core;

import java.util.Objects;

/**
 * A single record headed for the producer client.
 *
 * <p>The payload array is shared, not copied: file-backed generators hand the same pooled
 * bytes to many messages, so neither side may mutate it after construction.
 *
 * @param topic destination topic
 * @param partition destination partition, or {@link #ANY_PARTITION} to let the client choose
 * @param payload record value
 */
public record OutboundMessage(String topic, int partition, byte[] payload) {

    public static final int ANY_PARTITION = -1;

    public OutboundMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        if (partition < ANY_PARTITION) {
            throw new IllegalArgumentException("partition must be >= -1, got " + partition);
        }
    }

    public boolean hasExplicitPartition() {
        return partition != ANY_PARTITION;
    }

    public int size() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "OutboundMessage{topic='" + topic + "', partition=" + partition + ", bytes=" + payload.length + '}';
    }
}
