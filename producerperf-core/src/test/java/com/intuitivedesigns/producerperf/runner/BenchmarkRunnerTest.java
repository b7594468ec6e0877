/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.runner;

import com.intuitivedesigns.producerperf.client.FakeProducerClient;
import com.intuitivedesigns.producerperf.config.BenchmarkSettings;
import com.intuitivedesigns.producerperf.config.DispatchMode;
import com.intuitivedesigns.producerperf.dispatch.DispatchResult;
import com.intuitivedesigns.producerperf.errors.ConfigurationException;
import com.intuitivedesigns.producerperf.errors.DeliveryException;
import com.intuitivedesigns.producerperf.generator.RandomMessageGenerator;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkRunnerTest {

    private static final Duration PACER_WINDOW = Duration.ofMillis(5);

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Test
    void asyncRunPrintsFinalLineThenClosesClient() throws Exception {
        FakeProducerClient client = new FakeProducerClient();
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.ASYNC, 100, 1), recordingOut(client), PACER_WINDOW);

        DispatchResult result = runner.run(client, new RandomMessageGenerator(16));

        assertEquals(100, result.sends());
        assertEquals(List.of("print", "close"), client.events());
        assertTrue(output().startsWith("100 records sent"), output());
        assertEquals(1, client.closeCalls());
    }

    @Test
    void finalLineAndCloseWaitForEveryAsyncCompletion() throws Exception {
        FakeProducerClient client = new FakeProducerClient().holdCompletions();
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.ASYNC, 10, 1), recordingOut(client), PACER_WINDOW);
        Callable<DispatchResult> task = () -> runner.run(client, new RandomMessageGenerator(16));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<DispatchResult> running = pool.submit(task);
            assertTrue(client.awaitHeld(10, Duration.ofSeconds(5)), "sends never reached the client");

            client.releaseCompletions(9);
            Thread.sleep(100);
            assertFalse(running.isDone());
            assertEquals(0, client.closeCalls());
            assertEquals("", output());

            client.releaseCompletions(1);
            assertEquals(10, running.get(5, TimeUnit.SECONDS).sends());
        } finally {
            pool.shutdownNow();
        }

        List<String> events = client.events();
        assertEquals(List.of("print", "close"), events.subList(10, events.size()));
        assertEquals(Collections.nCopies(10, "completion"), events.subList(0, 10));
    }

    @Test
    void syncRunSplitsLoadAcrossWorkers() throws Exception {
        FakeProducerClient client = new FakeProducerClient();
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.SYNC, 10, 3), recordingOut(client), PACER_WINDOW);

        DispatchResult result = runner.run(client, new RandomMessageGenerator(16));

        assertEquals(10, result.sends());
        assertEquals(10, client.syncSends());
        assertEquals(List.of("print", "close"), client.events());
    }

    @Test
    void finalLineIsPrintedWhenClientExposesNoMetrics() throws Exception {
        FakeProducerClient client = new FakeProducerClient(false);
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.ASYNC, 10, 1), recordingOut(client), PACER_WINDOW);

        runner.run(client, new RandomMessageGenerator(16));

        assertTrue(output().startsWith("0 records sent"), output());
    }

    @Test
    void failedRunStillClosesTheClient() {
        FakeProducerClient client = new FakeProducerClient().failAt(3);
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.ASYNC, 20, 1), recordingOut(client), PACER_WINDOW);

        assertThrows(DeliveryException.class, () -> runner.run(client, new RandomMessageGenerator(16)));
        assertEquals(1, client.closeCalls());
        assertEquals("", output());
    }

    @Test
    void generatorBuildFailureClosesTheClient() {
        FakeProducerClient client = new FakeProducerClient();
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.ASYNC, 5, 1), recordingOut(client), PACER_WINDOW);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> runner.run(client, () -> {
            throw new ConfigurationException("Unknown message decoder: 'zlib'");
        }));
        assertTrue(e.getMessage().contains("zlib"));
        assertEquals(List.of("close"), client.events());
        assertEquals(0, client.asyncSends());
    }

    @Test
    void closeFailureIsFatalAfterFinalLine() {
        FakeProducerClient client = new FakeProducerClient().failOnClose(new DeliveryException("close failed"));
        BenchmarkRunner runner = new BenchmarkRunner(settings(DispatchMode.ASYNC, 5, 1), recordingOut(client), PACER_WINDOW);

        DeliveryException e = assertThrows(DeliveryException.class, () -> runner.run(client, new RandomMessageGenerator(16)));
        assertEquals("close failed", e.getMessage());
        assertEquals(List.of("print", "close"), client.events());
    }

    private static BenchmarkSettings settings(DispatchMode mode, int load, int routines) {
        return BenchmarkSettings.builder()
                .brokers(List.of("localhost:9092"))
                .topic("bench")
                .mode(mode)
                .messageLoad(load)
                .messageSize(16)
                .routines(routines)
                .reportInterval(Duration.ofMinutes(1))
                .build();
    }

    private PrintStream recordingOut(FakeProducerClient client) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8) {
            @Override
            public void println(String x) {
                client.recordEvent("print");
                super.println(x);
            }
        };
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
