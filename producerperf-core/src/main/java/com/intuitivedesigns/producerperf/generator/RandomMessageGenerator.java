/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.errors.GenerationException;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Fixed-size payloads filled from a cryptographically strong random source.
 *
 * <p>Every message gets a fresh buffer; payloads are never reused across messages.
 */
public final class RandomMessageGenerator extends AbstractMessageGenerator {

    private final int messageSize;
    private final Random random;

    public RandomMessageGenerator(int messageSize) {
        this(messageSize, new SecureRandom());
    }

    RandomMessageGenerator(int messageSize, Random random) {
        if (messageSize <= 0) throw new IllegalArgumentException("messageSize must be > 0");
        this.messageSize = messageSize;
        this.random = Objects.requireNonNull(random, "random");
    }

    public int messageSize() {
        return messageSize;
    }

    @Override
    protected byte[] payloadAt(int index) {
        final byte[] payload = new byte[messageSize];
        try {
            random.nextBytes(payload);
        } catch (RuntimeException e) {
            throw new GenerationException("Failed to generate message payload: " + e.getMessage(), e);
        }
        return payload;
    }
}
