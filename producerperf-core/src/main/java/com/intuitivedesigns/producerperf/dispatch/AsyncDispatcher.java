/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.dispatch;

import com.intuitivedesigns.producerperf.client.ProducerClient;
import com.intuitivedesigns.producerperf.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.producerperf.core.DeliveryOutcome;
import com.intuitivedesigns.producerperf.core.OutboundMessage;
import com.intuitivedesigns.producerperf.errors.BenchmarkException;
import com.intuitivedesigns.producerperf.errors.DeliveryException;
import com.intuitivedesigns.producerperf.generator.GenerationJob;
import com.intuitivedesigns.producerperf.generator.MessageGenerator;
import com.intuitivedesigns.producerperf.generator.MessageStream;
import com.intuitivedesigns.producerperf.pace.ThroughputPacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One generator feeding the client's asynchronous input, with a collector thread counting
 * completions.
 *
 * <p>The dispatch finishes only after the collector has seen exactly {@code load} outcomes, so
 * nothing downstream (final metrics, client close) runs while sends are still in flight. The first
 * failed outcome ends the run.
 */
public final class AsyncDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(AsyncDispatcher.class);

    private final ProducerClient client;
    private final MessageGenerator generator;
    private final GenerationJob job;
    private final int throughput;
    private final Duration window;

    public AsyncDispatcher(ProducerClient client,
                           MessageGenerator generator,
                           GenerationJob job,
                           int throughput,
                           Duration window) {
        this.client = Objects.requireNonNull(client, "client");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.job = Objects.requireNonNull(job, "job");
        this.window = Objects.requireNonNull(window, "window");
        if (throughput < 0) throw new IllegalArgumentException("throughput must be >= 0");
        this.throughput = throughput;
    }

    @Override
    public DispatchResult dispatch() throws InterruptedException {
        final long startNs = System.nanoTime();
        final int load = job.count();
        log.info("Async dispatch started: load={} throughput={}", load, throughput == 0 ? "unlimited" : throughput);

        final ExecutorService collectorPool = Executors.newSingleThreadExecutor(new NamedDaemonThreadFactory("perf-completions"));
        final MessageStream messages = generator.generate(job);

        try (ThroughputPacer pacer = ThroughputPacer.start(throughput, window)) {
            final Future<Long> collector = collectorPool.submit(() -> collect(load));

            long sent = 0;
            OutboundMessage message;
            while ((message = messages.next()) != null) {
                if (collector.isDone()) {
                    // only a failed collector finishes early
                    awaitCollector(collector);
                }
                client.sendAsync(message);
                sent++;
                pacer.onEmitted();
            }

            final long acknowledged = awaitCollector(collector);
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);
            log.info("Async dispatch finished: sent={} acknowledged={} elapsed={}ms", sent, acknowledged, elapsed.toMillis());
            return new DispatchResult(sent, sent, elapsed);
        } finally {
            messages.cancel();
            collectorPool.shutdownNow();
        }
    }

    private long collect(int expected) throws InterruptedException {
        for (long i = 0; i < expected; i++) {
            final DeliveryOutcome outcome = client.awaitCompletion();
            if (!outcome.succeeded()) {
                final Throwable error = outcome.error();
                throw new DeliveryException("Failed to deliver message to " + outcome.message().topic()
                        + ": " + error.getMessage(), error);
            }
        }
        return expected;
    }

    private static long awaitCollector(Future<Long> collector) throws InterruptedException {
        try {
            return collector.get();
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        }
    }

    static RuntimeException propagate(Throwable cause) {
        if (cause instanceof BenchmarkException be) return be;
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new DeliveryException("Dispatch failed: " + cause.getMessage(), cause);
    }
}
