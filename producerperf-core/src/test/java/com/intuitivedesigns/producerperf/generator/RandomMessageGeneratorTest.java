/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.core.OutboundMessage;
import com.intuitivedesigns.producerperf.errors.GenerationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RandomMessageGeneratorTest {

    @Test
    void emitsExactlyCountMessagesOfConfiguredSize() throws Exception {
        MessageStream stream = new RandomMessageGenerator(16).generate("bench", 3, 100);

        List<OutboundMessage> out = drain(stream);

        assertEquals(100, out.size());
        for (OutboundMessage m : out) {
            assertEquals("bench", m.topic());
            assertEquals(3, m.partition());
            assertEquals(16, m.size());
        }
        assertNull(stream.next()); // stays closed
    }

    @Test
    void payloadBuffersAreNotShared() throws Exception {
        List<OutboundMessage> out = drain(new RandomMessageGenerator(8).generate("t", -1, 10));

        Set<byte[]> identities = new HashSet<>();
        for (OutboundMessage m : out) {
            identities.add(m.payload());
        }
        assertEquals(10, identities.size());
    }

    @Test
    void randomSourceFailureSurfacesAsGenerationException() {
        Random broken = new Random() {
            @Override
            public void nextBytes(byte[] bytes) {
                throw new IllegalStateException("entropy exhausted");
            }
        };
        MessageStream stream = new RandomMessageGenerator(4, broken).generate("t", -1, 5);

        GenerationException e = assertThrows(GenerationException.class, () -> drain(stream));
        assertTrue(e.getMessage().contains("entropy exhausted"));
    }

    @Test
    void errorInWriterEndsTheStreamInsteadOfHangingTheReader() {
        Random exhausted = new Random() {
            @Override
            public void nextBytes(byte[] bytes) {
                throw new OutOfMemoryError("Java heap space");
            }
        };
        MessageStream stream = new RandomMessageGenerator(4, exhausted).generate("t", -1, 4);

        GenerationException e = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(GenerationException.class, () -> drain(stream)));
        assertInstanceOf(OutOfMemoryError.class, e.getCause());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new RandomMessageGenerator(0));
    }

    static List<OutboundMessage> drain(MessageStream stream) throws InterruptedException {
        List<OutboundMessage> out = new ArrayList<>();
        OutboundMessage m;
        while ((m = stream.next()) != null) {
            out.add(m);
        }
        return out;
    }
}
