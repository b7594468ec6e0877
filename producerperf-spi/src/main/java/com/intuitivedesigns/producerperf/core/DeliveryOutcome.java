/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.core;

import java.util.Objects;

/**
 * Completion notification for an asynchronously sent message.
 * Exactly one of {@code receipt} and {@code error} is non-null.
 */
public record DeliveryOutcome(OutboundMessage message, DeliveryReceipt receipt, Throwable error) {

    public DeliveryOutcome {
        Objects.requireNonNull(message, "message");
        if ((receipt == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of receipt or error must be set");
        }
    }

    public static DeliveryOutcome success(OutboundMessage message, DeliveryReceipt receipt) {
        return new DeliveryOutcome(message, Objects.requireNonNull(receipt, "receipt"), null);
    }

    public static DeliveryOutcome failure(OutboundMessage message, Throwable error) {
        return new DeliveryOutcome(message, null, Objects.requireNonNull(error, "error"));
    }

    public boolean succeeded() {
        return error == null;
    }
}
