/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.runner;

import com.intuitivedesigns.producerperf.client.ProducerClient;
import com.intuitivedesigns.producerperf.config.BenchmarkSettings;
import com.intuitivedesigns.producerperf.dispatch.AsyncDispatcher;
import com.intuitivedesigns.producerperf.dispatch.DispatchPlan;
import com.intuitivedesigns.producerperf.dispatch.DispatchResult;
import com.intuitivedesigns.producerperf.dispatch.Dispatcher;
import com.intuitivedesigns.producerperf.dispatch.SyncDispatcher;
import com.intuitivedesigns.producerperf.generator.GenerationJob;
import com.intuitivedesigns.producerperf.generator.MessageGenerator;
import com.intuitivedesigns.producerperf.pace.ThroughputPacer;
import com.intuitivedesigns.producerperf.report.MetricsReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One benchmark run: reporter up, generator built, dispatch, reporter down, final stats line,
 * client closed.
 *
 * <p>The final line is printed before the client is closed so it reflects the instruments of a
 * live client. On failure the client is still closed and any close error is attached as
 * suppressed.
 */
public final class BenchmarkRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final BenchmarkSettings settings;
    private final PrintStream out;
    private final Duration pacerWindow;

    public BenchmarkRunner(BenchmarkSettings settings, PrintStream out) {
        this(settings, out, ThroughputPacer.DEFAULT_WINDOW);
    }

    public BenchmarkRunner(BenchmarkSettings settings, PrintStream out, Duration pacerWindow) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.out = Objects.requireNonNull(out, "out");
        this.pacerWindow = Objects.requireNonNull(pacerWindow, "pacerWindow");
    }

    public DispatchResult run(ProducerClient client, MessageGenerator generator) throws InterruptedException {
        Objects.requireNonNull(generator, "generator");
        return run(client, () -> generator);
    }

    /**
     * Runs with a generator built after the reporter has started. A failure to build it (bad
     * decoder, unreadable message file) takes the same path as a dispatch failure.
     */
    public DispatchResult run(ProducerClient client, Supplier<? extends MessageGenerator> generators) throws InterruptedException {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(generators, "generators");

        final MetricsReporter reporter = new MetricsReporter(client.metrics(), settings.messageSize(), out, settings.reportInterval());
        final DispatchResult result;
        try {
            reporter.start();
            final MessageGenerator generator = Objects.requireNonNull(generators.get(), "generator");
            result = dispatcherFor(client, generator).dispatch();
            reporter.stop();
            reporter.printFinal();
        } catch (RuntimeException | InterruptedException e) {
            try {
                reporter.stop();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            closeQuietly(client, e);
            throw e;
        }

        client.close();
        log.info("Benchmark complete: mode={} messages={} sends={} elapsed={}ms",
                settings.mode(), result.generated(), result.sends(), result.elapsed().toMillis());
        return result;
    }

    Dispatcher dispatcherFor(ProducerClient client, MessageGenerator generator) {
        if (settings.sync()) {
            return new SyncDispatcher(client, generator, settings.topic(), settings.partition(),
                    new DispatchPlan(settings.messageLoad(), settings.routines()),
                    settings.throughput(), pacerWindow);
        }
        return new AsyncDispatcher(client, generator,
                new GenerationJob(settings.messageLoad(), settings.topic(), settings.partition()),
                settings.throughput(), pacerWindow);
    }

    private static void closeQuietly(ProducerClient client, Exception primary) {
        try {
            client.close();
        } catch (RuntimeException closeError) {
            primary.addSuppressed(closeError);
        }
    }
}
