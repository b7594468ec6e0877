/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.app;

import ch.qos.logback.classic.Level;
import com.intuitivedesigns.producerperf.config.BenchmarkSettings;
import com.intuitivedesigns.producerperf.config.ConfigSource;
import com.intuitivedesigns.producerperf.errors.BenchmarkException;
import com.intuitivedesigns.producerperf.generator.MessageGenerators;
import com.intuitivedesigns.producerperf.kafka.KafkaProducerClient;
import com.intuitivedesigns.producerperf.metrics.MetricsSettings;
import com.intuitivedesigns.producerperf.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.producerperf.runner.BenchmarkRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Command line entry point.
 *
 * <p>Arguments are {@code key=value} pairs (for example {@code brokers=localhost:9092
 * topic=bench message.load=100000 message.size=100}); {@code -Dperf.*} system properties and a
 * properties file named by {@code -Dperf.config.path} are read first.
 *
 * <p>Exit status: 0 on success, 64 for a bad invocation, 69 when the run fails.
 */
public final class ProducerPerfApp {

    private static final Logger log = LoggerFactory.getLogger(ProducerPerfApp.class);

    static final int EXIT_OK = 0;

    private static final String KAFKA_LOGGER = "org.apache.kafka";

    private ProducerPerfApp() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            final ConfigSource config = ConfigSource.load(args);
            return run(BenchmarkSettings.from(config), MetricsSettings.from(config), out);
        } catch (BenchmarkException e) {
            return fail(err, e.exitStatus(), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(err, BenchmarkException.EXIT_UNAVAILABLE, "Interrupted", e);
        } catch (RuntimeException e) {
            return fail(err, BenchmarkException.EXIT_UNAVAILABLE, String.valueOf(e.getMessage()), e);
        }
    }

    private static int run(BenchmarkSettings settings, MetricsSettings metricsSettings, PrintStream out) throws InterruptedException {
        if (settings.verbose()) {
            enableClientDebugLogging();
        }
        log.info("Starting producer benchmark: {}", settings);

        try (MicrometerMetricsRuntime metrics = MicrometerMetricsRuntime.fromSettings(metricsSettings)) {
            final KafkaProducerClient client = KafkaProducerClient.create(settings, metrics.registry());
            // the decoder is resolved before the message file is opened
            new BenchmarkRunner(settings, out).run(client, () -> MessageGenerators.forSettings(settings));
        }
        return EXIT_OK;
    }

    private static void enableClientDebugLogging() {
        final Logger kafka = LoggerFactory.getLogger(KAFKA_LOGGER);
        if (kafka instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        } else {
            log.warn("Verbose mode requested but logging backend is not Logback; leaving '{}' level unchanged", KAFKA_LOGGER);
        }
    }

    private static int fail(PrintStream err, int status, String message, Throwable cause) {
        log.debug("Benchmark failed with status {}", status, cause);
        err.println("ERROR: " + message);
        err.println();
        return status;
    }
}
