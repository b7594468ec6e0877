/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.kafka;

import com.intuitivedesigns.producerperf.client.ProducerClient;
import com.intuitivedesigns.producerperf.config.BenchmarkSettings;
import com.intuitivedesigns.producerperf.config.PartitionerType;
import com.intuitivedesigns.producerperf.core.DeliveryOutcome;
import com.intuitivedesigns.producerperf.core.DeliveryReceipt;
import com.intuitivedesigns.producerperf.core.OutboundMessage;
import com.intuitivedesigns.producerperf.errors.DeliveryException;
import com.intuitivedesigns.producerperf.metrics.LatencyHistogram;
import com.intuitivedesigns.producerperf.metrics.LongCounter;
import com.intuitivedesigns.producerperf.metrics.ProducerMetrics;
import com.intuitivedesigns.producerperf.metrics.RateMeter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ProducerClient} over a {@code KafkaProducer<byte[], byte[]>}.
 *
 * <p>Every send goes through the same completion callback, which records the send-to-ack latency
 * and feeds the outcome queue for async sends. The four report instruments are registered on the
 * first send.
 */
public final class KafkaProducerClient implements ProducerClient {

    private static final Logger log = LoggerFactory.getLogger(KafkaProducerClient.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final Producer<byte[], byte[]> producer;
    private final boolean manualPartitioning;
    private final ProducerMetrics metrics;
    private final BlockingQueue<DeliveryOutcome> completions = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Instruments instruments;

    public static KafkaProducerClient create(BenchmarkSettings settings, MeterRegistry registry) {
        Objects.requireNonNull(settings, "settings");
        final Properties props = KafkaClientProperties.build(settings);
        final Producer<byte[], byte[]> producer;
        try {
            producer = new KafkaProducer<>(props);
        } catch (KafkaException e) {
            throw new DeliveryException("Failed to create producer: " + e.getMessage(), e);
        }
        log.info("Kafka producer created: brokers={} clientId={} acks={} partitioner={} compression={}",
                settings.brokers(), settings.clientId(), KafkaClientProperties.acks(settings.requiredAcks()),
                settings.partitioner(), settings.compression());
        return new KafkaProducerClient(producer, settings.partitioner() == PartitionerType.MANUAL, new ProducerMetrics(registry));
    }

    public KafkaProducerClient(Producer<byte[], byte[]> producer, boolean manualPartitioning, ProducerMetrics metrics) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.manualPartitioning = manualPartitioning;
    }

    @Override
    public void sendAsync(OutboundMessage message) {
        send(message, true);
    }

    @Override
    public DeliveryOutcome awaitCompletion() throws InterruptedException {
        return completions.take();
    }

    @Override
    public DeliveryReceipt sendSync(OutboundMessage message) throws InterruptedException {
        try {
            final RecordMetadata md = send(message, false).get();
            return new DeliveryReceipt(md.topic(), md.partition(), md.offset());
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new DeliveryException("Failed to deliver message to " + message.topic() + ": " + cause.getMessage(), cause);
        }
    }

    private Future<RecordMetadata> send(OutboundMessage message, boolean notify) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            throw new DeliveryException("Producer is closed");
        }
        final Instruments in = instruments();
        final ProducerRecord<byte[], byte[]> record = toRecord(message);
        final long startNs = System.nanoTime();

        in.inFlight.increment();
        in.outgoingBytes.mark(message.size());
        final Callback callback = (md, ex) -> {
            in.inFlight.decrement();
            if (ex == null) {
                in.latency.recordNanos(System.nanoTime() - startNs);
                in.sendRate.mark();
                if (log.isTraceEnabled()) {
                    log.trace("Acked: topic={} part={} off={}", md.topic(), md.partition(), md.offset());
                }
            } else {
                log.debug("Send failed: topic={}", message.topic(), ex);
            }
            if (notify) {
                completions.add(ex == null
                        ? DeliveryOutcome.success(message, new DeliveryReceipt(md.topic(), md.partition(), md.offset()))
                        : DeliveryOutcome.failure(message, ex));
            }
        };

        try {
            return producer.send(record, callback);
        } catch (KafkaException e) {
            in.inFlight.decrement();
            throw new DeliveryException("Producer rejected message for " + message.topic() + ": " + e.getMessage(), e);
        }
    }

    ProducerRecord<byte[], byte[]> toRecord(OutboundMessage message) {
        final Integer partition = manualPartitioning && message.hasExplicitPartition() ? message.partition() : null;
        return new ProducerRecord<>(message.topic(), partition, null, message.payload());
    }

    private Instruments instruments() {
        Instruments in = instruments;
        if (in == null) {
            synchronized (this) {
                in = instruments;
                if (in == null) {
                    in = new Instruments(metrics);
                    instruments = in;
                }
            }
        }
        return in;
    }

    @Override
    public ProducerMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Closing Kafka producer...");
        try {
            producer.flush();
            producer.close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            throw new DeliveryException("Failed to close producer: " + e.getMessage(), e);
        }
    }

    private static final class Instruments {
        final RateMeter sendRate;
        final LatencyHistogram latency;
        final RateMeter outgoingBytes;
        final LongCounter inFlight;

        Instruments(ProducerMetrics metrics) {
            this.sendRate = metrics.meter(ProducerMetrics.RECORD_SEND_RATE);
            this.latency = metrics.histogram(ProducerMetrics.REQUEST_LATENCY);
            this.outgoingBytes = metrics.meter(ProducerMetrics.OUTGOING_BYTE_RATE);
            this.inFlight = metrics.counter(ProducerMetrics.REQUESTS_IN_FLIGHT);
        }
    }
}
