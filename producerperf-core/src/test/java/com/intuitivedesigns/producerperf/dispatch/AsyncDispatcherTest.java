/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.dispatch;

import com.intuitivedesigns.producerperf.client.FakeProducerClient;
import com.intuitivedesigns.producerperf.errors.DeliveryException;
import com.intuitivedesigns.producerperf.errors.GenerationException;
import com.intuitivedesigns.producerperf.generator.AbstractMessageGenerator;
import com.intuitivedesigns.producerperf.generator.GenerationJob;
import com.intuitivedesigns.producerperf.generator.RandomMessageGenerator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncDispatcherTest {

    private static final Duration WINDOW = Duration.ofMillis(10);

    @Test
    void deliversEveryMessage() throws Exception {
        FakeProducerClient client = new FakeProducerClient();
        AsyncDispatcher dispatcher = new AsyncDispatcher(client, new RandomMessageGenerator(16),
                new GenerationJob(100, "bench", -1), 0, WINDOW);

        DispatchResult result = dispatcher.dispatch();

        assertEquals(100, result.generated());
        assertEquals(100, result.sends());
        assertEquals(100, client.asyncSends());
        assertEquals(0, client.syncSends());
        client.sent().forEach(m -> assertEquals(16, m.size()));
    }

    @Test
    void pacedRunStillDeliversEveryMessage() throws Exception {
        FakeProducerClient client = new FakeProducerClient();
        AsyncDispatcher dispatcher = new AsyncDispatcher(client, new RandomMessageGenerator(4),
                new GenerationJob(30, "bench", 0), 10, WINDOW);

        DispatchResult result = dispatcher.dispatch();

        assertEquals(30, result.sends());
        assertEquals(30, client.asyncSends());
    }

    @Test
    void dispatchReturnsOnlyAfterTheLastCompletion() throws Exception {
        FakeProducerClient client = new FakeProducerClient().holdCompletions();
        AsyncDispatcher dispatcher = new AsyncDispatcher(client, new RandomMessageGenerator(4),
                new GenerationJob(20, "bench", -1), 0, WINDOW);
        Callable<DispatchResult> task = dispatcher::dispatch;

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<DispatchResult> running = pool.submit(task);
            assertTrue(client.awaitHeld(20, Duration.ofSeconds(5)), "sends never reached the client");

            assertEquals(19, client.releaseCompletions(19));
            Thread.sleep(100);
            assertFalse(running.isDone(), "dispatch returned with a completion outstanding");

            assertEquals(1, client.releaseCompletions(1));
            DispatchResult result = running.get(5, TimeUnit.SECONDS);
            assertEquals(20, result.sends());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedDeliveryEndsTheRun() {
        FakeProducerClient client = new FakeProducerClient().failAt(7);
        AsyncDispatcher dispatcher = new AsyncDispatcher(client, new RandomMessageGenerator(4),
                new GenerationJob(50, "bench", -1), 0, WINDOW);

        DeliveryException e = assertThrows(DeliveryException.class, dispatcher::dispatch);
        assertTrue(e.getMessage().contains("broker unavailable"), e.getMessage());
    }

    @Test
    void generatorFailureEndsTheRun() {
        AbstractMessageGenerator failing = new AbstractMessageGenerator() {
            @Override
            protected byte[] payloadAt(int index) {
                if (index == 3) throw new GenerationException("boom");
                return new byte[1];
            }
        };
        AsyncDispatcher dispatcher = new AsyncDispatcher(new FakeProducerClient(), failing,
                new GenerationJob(10, "bench", -1), 0, WINDOW);

        assertThrows(GenerationException.class, dispatcher::dispatch);
    }
}
