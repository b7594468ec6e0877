/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.dispatch;

import com.intuitivedesigns.producerperf.client.ProducerClient;
import com.intuitivedesigns.producerperf.concurrent.NamedDaemonThreadFactory;
import com.intuitivedesigns.producerperf.core.OutboundMessage;
import com.intuitivedesigns.producerperf.generator.MessageGenerator;
import com.intuitivedesigns.producerperf.generator.MessageStream;
import com.intuitivedesigns.producerperf.pace.ThroughputPacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Blocking round trips from several workers sharing one client.
 *
 * <p>The load is split by {@link DispatchPlan}; each worker owns its generator stream and, when
 * pacing is enabled, its own {@link ThroughputPacer}, so the aggregate rate scales with the worker
 * count. A paced worker sends each message {@code throughput} times in a row and then waits for
 * its next tick.
 */
public final class SyncDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(SyncDispatcher.class);

    private final ProducerClient client;
    private final MessageGenerator generator;
    private final String topic;
    private final int partition;
    private final DispatchPlan plan;
    private final int throughput;
    private final Duration window;

    public SyncDispatcher(ProducerClient client,
                          MessageGenerator generator,
                          String topic,
                          int partition,
                          DispatchPlan plan,
                          int throughput,
                          Duration window) {
        this.client = Objects.requireNonNull(client, "client");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.window = Objects.requireNonNull(window, "window");
        if (throughput < 0) throw new IllegalArgumentException("throughput must be >= 0");
        this.partition = partition;
        this.throughput = throughput;
    }

    @Override
    public DispatchResult dispatch() throws InterruptedException {
        final long startNs = System.nanoTime();
        log.info("Sync dispatch started: load={} workers={} chunks={} throughput={}",
                plan.load(), plan.workers(), plan.chunks(), throughput == 0 ? "unlimited" : throughput + "/worker");

        final ExecutorService workers = Executors.newFixedThreadPool(plan.workers(), new NamedDaemonThreadFactory("perf-sync-worker"));
        final CompletionService<WorkerTally> completions = new ExecutorCompletionService<>(workers);

        try {
            for (int w = 0; w < plan.workers(); w++) {
                final MessageStream stream = generator.generate(topic, partition, plan.chunkSize(w));
                completions.submit(() -> runWorker(stream));
            }

            long generated = 0;
            long sends = 0;
            for (int done = 0; done < plan.workers(); done++) {
                final Future<WorkerTally> finished = completions.take();
                final WorkerTally tally;
                try {
                    tally = finished.get();
                } catch (ExecutionException e) {
                    throw AsyncDispatcher.propagate(e.getCause());
                }
                generated += tally.generated;
                sends += tally.sends;
            }

            final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);
            log.info("Sync dispatch finished: generated={} sends={} elapsed={}ms", generated, sends, elapsed.toMillis());
            return new DispatchResult(generated, sends, elapsed);
        } finally {
            workers.shutdownNow();
        }
    }

    private WorkerTally runWorker(MessageStream stream) throws InterruptedException {
        final WorkerTally tally = new WorkerTally();
        try (ThroughputPacer pacer = ThroughputPacer.start(throughput, window)) {
            OutboundMessage message;
            while ((message = stream.next()) != null) {
                tally.generated++;
                if (pacer.enabled()) {
                    for (int i = 0; i < throughput; i++) {
                        client.sendSync(message);
                        tally.sends++;
                    }
                    pacer.awaitTick();
                } else {
                    client.sendSync(message);
                    tally.sends++;
                }
            }
        } finally {
            stream.cancel();
        }
        return tally;
    }

    private static final class WorkerTally {
        long generated;
        long sends;
    }
}
