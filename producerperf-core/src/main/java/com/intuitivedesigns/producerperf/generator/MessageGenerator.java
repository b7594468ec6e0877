/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

/**
 * Produces the outbound messages of a benchmark run.
 *
 * <p>Each call to {@link #generate} starts an independent background task writing exactly
 * {@code job.count()} messages into a fresh {@link MessageStream} and then closing it.
 */
public interface MessageGenerator {

    MessageStream generate(GenerationJob job);

    default MessageStream generate(String topic, int partition, int count) {
        return generate(new GenerationJob(count, topic, partition));
    }
}
