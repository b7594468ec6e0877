/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.client;

import com.intuitivedesigns.producerperf.core.DeliveryOutcome;
import com.intuitivedesigns.producerperf.core.DeliveryReceipt;
import com.intuitivedesigns.producerperf.core.OutboundMessage;
import com.intuitivedesigns.producerperf.errors.DeliveryException;
import com.intuitivedesigns.producerperf.metrics.ProducerMetrics;

/**
 * The produce API the benchmark drives.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>Implementations must be safe for concurrent use: sync workers call {@link #sendSync}
 * from several threads while the reporter reads {@link #metrics()}.</li>
 * <li>Every message accepted by {@link #sendAsync} yields exactly one {@link DeliveryOutcome}
 * from {@link #awaitCompletion()}, in completion order.</li>
 * <li>Failures are reported as {@link DeliveryException}; callers do not retry.</li>
 * </ul>
 */
public interface ProducerClient extends AutoCloseable {

    /**
     * Hands a message to the client without waiting for the broker. May block when the
     * client's own buffers are full.
     *
     * @throws DeliveryException if the client rejects the message outright
     */
    void sendAsync(OutboundMessage message) throws InterruptedException;

    /**
     * Blocks until the next asynchronous send completes, successfully or not.
     */
    DeliveryOutcome awaitCompletion() throws InterruptedException;

    /**
     * Blocking round trip.
     *
     * @throws DeliveryException if the broker does not acknowledge the record
     */
    DeliveryReceipt sendSync(OutboundMessage message) throws InterruptedException;

    /**
     * Instruments maintained by this client. Read-only for callers.
     */
    ProducerMetrics metrics();

    /**
     * Flushes buffered records and releases connections.
     *
     * @throws DeliveryException if the client fails to shut down cleanly
     */
    @Override
    void close();
}
