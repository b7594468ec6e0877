/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.core.OutboundMessage;
import com.intuitivedesigns.producerperf.errors.BenchmarkException;
import com.intuitivedesigns.producerperf.errors.GenerationException;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded, closable hand-off between one generator task and one consumer.
 *
 * <p>The writer blocks when the buffer is full, the reader when it is empty. The writer ends the
 * stream with {@link #close()} or {@link #fail(Throwable)}; after that {@link #next()} drains the
 * remaining messages and then returns {@code null} (or throws the failure).
 */
public final class MessageStream {

    static final int MAX_CAPACITY = 65_536;

    private static final OutboundMessage END = new OutboundMessage("", OutboundMessage.ANY_PARTITION, new byte[0]);

    private final BlockingQueue<OutboundMessage> queue;
    private final int capacity;

    private volatile Throwable failure;
    private volatile Thread writer;
    private boolean exhausted; // reader-owned

    public MessageStream(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Buffer size for a job of {@code count} messages: a quarter of the job, at most 65536.
     */
    public static int capacityFor(int count) {
        return Math.max(1, Math.min(count / 4, MAX_CAPACITY));
    }

    public int capacity() {
        return capacity;
    }

    // --- Writer side ---

    void attachWriter(Thread thread) {
        this.writer = thread;
    }

    void put(OutboundMessage message) throws InterruptedException {
        queue.put(message);
    }

    void close() throws InterruptedException {
        queue.put(END);
    }

    void fail(Throwable cause) throws InterruptedException {
        this.failure = cause;
        queue.put(END);
    }

    // --- Reader side ---

    /**
     * @return the next message, or {@code null} once the stream is closed and drained
     * @throws BenchmarkException if the generator failed
     */
    public OutboundMessage next() throws InterruptedException {
        if (exhausted) return terminal();
        final OutboundMessage m = queue.take();
        if (m == END) {
            exhausted = true;
            return terminal();
        }
        return m;
    }

    /**
     * Stops the writer if it is still producing. Safe to call at any time.
     */
    public void cancel() {
        final Thread w = writer;
        if (w != null && w.isAlive()) {
            w.interrupt();
        }
        queue.clear();
    }

    private OutboundMessage terminal() {
        final Throwable f = failure;
        if (f == null) return null;
        if (f instanceof BenchmarkException be) throw be;
        throw new GenerationException("Message generator failed: " + f.getMessage(), f);
    }
}
