/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.pace;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ThroughputPacerTest {

    @Test
    void zeroThroughputNeverBlocks() throws Exception {
        try (ThroughputPacer pacer = ThroughputPacer.start(0, Duration.ofHours(1))) {
            assertFalse(pacer.enabled());
            assertSame(ThroughputPacer.unbounded(), pacer);

            long start = System.nanoTime();
            for (int i = 0; i < 100_000; i++) {
                pacer.onEmitted();
            }
            pacer.awaitTick();
            assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 5);
        }
    }

    @Test
    void waitsForOneTickPerQuota() throws Exception {
        Duration window = Duration.ofMillis(20);
        try (ThroughputPacer pacer = ThroughputPacer.start(5, window)) {
            long start = System.nanoTime();
            for (int i = 0; i < 20; i++) {
                pacer.onEmitted();
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            // 4 full quotas need 4 ticks; the first arrives one window after start
            assertTrue(elapsed.toMillis() >= 3 * window.toMillis(), "elapsed " + elapsed);
            assertTrue(elapsed.toSeconds() < 5, "elapsed " + elapsed);
        }
    }

    @Test
    void atMostOneTickIsBanked() throws Exception {
        try (ThroughputPacer pacer = ThroughputPacer.start(1, Duration.ofMillis(2))) {
            Thread.sleep(100); // ~50 ticks fire with nobody consuming

            assertEquals(1, pacer.pendingTicks());

            pacer.awaitTick();
            assertTrue(pacer.pendingTicks() <= 1);
        }
    }

    @Test
    void rejectsNegativeThroughputAndEmptyWindow() {
        assertThrows(IllegalArgumentException.class, () -> ThroughputPacer.start(-1, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> ThroughputPacer.start(10, Duration.ZERO));
    }
}
