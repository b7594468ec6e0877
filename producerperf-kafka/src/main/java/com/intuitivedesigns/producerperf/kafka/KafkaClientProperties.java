/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.kafka;

import com.intuitivedesigns.producerperf.config.BenchmarkSettings;
import com.intuitivedesigns.producerperf.config.PartitionerType;
import com.intuitivedesigns.producerperf.config.SecurityProtocol;
import com.intuitivedesigns.producerperf.errors.DeliveryException;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.RoundRobinPartitioner;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Translates {@link BenchmarkSettings} into {@link org.apache.kafka.clients.producer.KafkaProducer}
 * properties.
 */
public final class KafkaClientProperties {

    static final String PEM = "PEM";

    // Kafka refuses idempotence above this in-flight limit or without acks=all
    private static final int IDEMPOTENT_MAX_IN_FLIGHT = 5;

    private KafkaClientProperties() {}

    public static Properties build(BenchmarkSettings settings) {
        Objects.requireNonNull(settings, "settings");
        final Properties props = new Properties();

        // 1) Connection
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", settings.brokers()));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, settings.clientId());

        // 2) Durability
        props.put(ProducerConfig.ACKS_CONFIG, acks(settings.requiredAcks()));
        final int timeoutMs = (int) Math.min(Integer.MAX_VALUE, settings.timeout().toMillis());
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, settings.maxOpenRequests());
        if (settings.requiredAcks() != -1 || settings.maxOpenRequests() > IDEMPOTENT_MAX_IN_FLIGHT) {
            props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false);
        }
        // delivery.timeout.ms must cover linger + request timeout
        final long lingerMs = settings.flushFrequency().toMillis();
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,
                (int) Math.min(Integer.MAX_VALUE, Math.max(120_000L, lingerMs + timeoutMs)));

        // 3) Throughput
        props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, settings.maxMessageBytes());
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, settings.compression().kafkaName());
        props.put(ProducerConfig.LINGER_MS_CONFIG, (int) Math.min(Integer.MAX_VALUE, lingerMs));
        if (settings.flushBytes() > 0) {
            props.put(ProducerConfig.BATCH_SIZE_CONFIG, settings.flushBytes());
        }

        // 4) Partitioning
        final Class<?> partitioner = partitionerClass(settings.partitioner());
        if (partitioner != null) {
            props.put(ProducerConfig.PARTITIONER_CLASS_CONFIG, partitioner.getName());
        }

        // 5) Security
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, settings.securityProtocol().name());
        if (settings.securityProtocol() == SecurityProtocol.SSL) {
            applyPemMaterial(settings, props);
        }
        return props;
    }

    static String acks(int requiredAcks) {
        return requiredAcks == -1 ? "all" : Integer.toString(requiredAcks);
    }

    /**
     * @return the partitioner class, or {@code null} to keep the client default
     */
    static Class<?> partitionerClass(PartitionerType type) {
        switch (type) {
            case RANDOM:
                return RandomPartitioner.class;
            case ROUNDROBIN:
                return RoundRobinPartitioner.class;
            case HASH:
            case MANUAL:
            default:
                // manual routing sets the partition on each record, so the partitioner is never consulted
                return null;
        }
    }

    private static void applyPemMaterial(BenchmarkSettings settings, Properties props) {
        if (settings.tlsRootCaCerts() != null) {
            props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, PEM);
            props.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG,
                    readPem(settings.tlsRootCaCerts(), "root CA certificates"));
        }
        if (settings.tlsClientCert() != null) {
            props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, PEM);
            props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG,
                    readPem(settings.tlsClientCert(), "client certificate"));
            props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG,
                    readPem(settings.tlsClientKey(), "client key"));
        }
    }

    private static String readPem(String file, String what) {
        try {
            return Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            throw new DeliveryException("Failed to load " + what + " from file: " + file, e);
        }
    }
}
