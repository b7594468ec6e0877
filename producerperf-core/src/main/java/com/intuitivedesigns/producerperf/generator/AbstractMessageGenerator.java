/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.producerperf.core.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Runs the write loop shared by all generators on a dedicated daemon thread.
 */
public abstract class AbstractMessageGenerator implements MessageGenerator {

    private static final Logger log = LoggerFactory.getLogger(AbstractMessageGenerator.class);

    private static final ThreadFactory THREADS = new NamedDaemonThreadFactory("perf-generator");

    @Override
    public final MessageStream generate(GenerationJob job) {
        Objects.requireNonNull(job, "job");

        log.info(describe(job));
        final MessageStream stream = new MessageStream(MessageStream.capacityFor(job.count()));
        final Thread writer = THREADS.newThread(() -> writeAll(job, stream));
        stream.attachWriter(writer);
        writer.start();
        return stream;
    }

    private void writeAll(GenerationJob job, MessageStream stream) {
        try {
            try {
                for (int i = 0; i < job.count(); i++) {
                    stream.put(new OutboundMessage(job.topic(), job.partition(), payloadAt(i)));
                }
            } catch (RuntimeException | Error e) {
                // an Error (e.g. OutOfMemoryError on a huge payload) must still end the stream
                log.error("{} failed after producing part of {} messages", getClass().getSimpleName(), job.count(), e);
                stream.fail(e);
                return;
            }
            stream.close();
        } catch (InterruptedException ie) {
            // cancelled by the consumer
            Thread.currentThread().interrupt();
        }
    }

    protected String describe(GenerationJob job) {
        return getClass().getSimpleName() + " is generating " + job.count() + " messages";
    }

    /**
     * Payload for the {@code index}-th message of a job, called in index order from the writer
     * thread.
     */
    protected abstract byte[] payloadAt(int index);
}
