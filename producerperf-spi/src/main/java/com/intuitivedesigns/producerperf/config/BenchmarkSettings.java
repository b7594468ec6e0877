/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.config;

import com.intuitivedesigns.producerperf.errors.ConfigurationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Every tunable of a benchmark run, parsed and validated once at startup.
 *
 * <p>Components receive this value (or the parts they need) through their constructors and never
 * read configuration from ambient state.
 */
public final class BenchmarkSettings {

    // ---- Config keys ----
    public static final String KEY_SYNC = "perf.sync";
    public static final String KEY_MESSAGE_LOAD = "perf.message.load";
    public static final String KEY_MESSAGE_SIZE = "perf.message.size";
    public static final String KEY_MESSAGE_FILE = "perf.message.file";
    public static final String KEY_MESSAGE_DECODER = "perf.message.decoder";
    public static final String KEY_BROKERS = "perf.brokers";
    public static final String KEY_SECURITY_PROTOCOL = "perf.security.protocol";
    public static final String KEY_TLS_CA_CERTS = "perf.tls.ca.certs";
    public static final String KEY_TLS_CLIENT_CERT = "perf.tls.client.cert";
    public static final String KEY_TLS_CLIENT_KEY = "perf.tls.client.key";
    public static final String KEY_TOPIC = "perf.topic";
    public static final String KEY_PARTITION = "perf.partition";
    public static final String KEY_THROUGHPUT = "perf.throughput";
    public static final String KEY_MAX_OPEN_REQUESTS = "perf.max.open.requests";
    public static final String KEY_MAX_MESSAGE_BYTES = "perf.max.message.bytes";
    public static final String KEY_REQUIRED_ACKS = "perf.required.acks";
    public static final String KEY_TIMEOUT_MS = "perf.timeout.ms";
    public static final String KEY_PARTITIONER = "perf.partitioner";
    public static final String KEY_COMPRESSION = "perf.compression";
    public static final String KEY_FLUSH_FREQUENCY_MS = "perf.flush.frequency.ms";
    public static final String KEY_FLUSH_BYTES = "perf.flush.bytes";
    public static final String KEY_CLIENT_ID = "perf.client.id";
    public static final String KEY_ROUTINES = "perf.routines";
    public static final String KEY_VERBOSE = "perf.verbose";
    public static final String KEY_REPORT_INTERVAL_SECONDS = "perf.report.interval.seconds";

    // ---- Defaults ----
    public static final String DEFAULT_DECODER = "raw";

    /** Line decoder schemes accepted for {@value #KEY_MESSAGE_DECODER}. */
    public static final List<String> KNOWN_DECODERS = List.of("raw", "hex", "base64");
    public static final int DEFAULT_MAX_OPEN_REQUESTS = 5;
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 1_000_000;
    public static final int DEFAULT_REQUIRED_ACKS = 1;
    public static final long DEFAULT_TIMEOUT_MS = 10_000L;
    public static final String DEFAULT_CLIENT_ID = "producer-perf";
    public static final int DEFAULT_REPORT_INTERVAL_SECONDS = 5;

    private final DispatchMode mode;
    private final int messageLoad;
    private final int messageSize;
    private final String messageFile;
    private final String messageDecoder;
    private final List<String> brokers;
    private final SecurityProtocol securityProtocol;
    private final String tlsRootCaCerts;
    private final String tlsClientCert;
    private final String tlsClientKey;
    private final String topic;
    private final int partition;
    private final int throughput;
    private final int maxOpenRequests;
    private final int maxMessageBytes;
    private final int requiredAcks;
    private final Duration timeout;
    private final PartitionerType partitioner;
    private final CompressionCodec compression;
    private final Duration flushFrequency;
    private final int flushBytes;
    private final String clientId;
    private final int routines;
    private final boolean verbose;
    private final Duration reportInterval;

    private BenchmarkSettings(Builder b) {
        this.mode = b.mode;
        this.messageLoad = b.messageLoad;
        this.messageSize = b.messageSize;
        this.messageFile = b.messageFile;
        this.messageDecoder = b.messageDecoder;
        this.brokers = List.copyOf(b.brokers);
        this.securityProtocol = b.securityProtocol;
        this.tlsRootCaCerts = b.tlsRootCaCerts;
        this.tlsClientCert = b.tlsClientCert;
        this.tlsClientKey = b.tlsClientKey;
        this.topic = b.topic;
        this.partition = b.partition;
        this.throughput = b.throughput;
        this.maxOpenRequests = b.maxOpenRequests;
        this.maxMessageBytes = b.maxMessageBytes;
        this.requiredAcks = b.requiredAcks;
        this.timeout = b.timeout;
        this.partitioner = b.partitioner;
        this.compression = b.compression;
        this.flushFrequency = b.flushFrequency;
        this.flushBytes = b.flushBytes;
        this.clientId = b.clientId;
        this.routines = b.routines;
        this.verbose = b.verbose;
        this.reportInterval = b.reportInterval;
    }

    public static BenchmarkSettings from(ConfigSource config) {
        Objects.requireNonNull(config, "config");

        final Builder b = builder()
                .mode(config.getBoolean(KEY_SYNC, false) ? DispatchMode.SYNC : DispatchMode.ASYNC)
                .messageLoad(config.getInt(KEY_MESSAGE_LOAD, 0))
                .messageSize(config.getInt(KEY_MESSAGE_SIZE, 0))
                .messageFile(config.getString(KEY_MESSAGE_FILE, null))
                .messageDecoder(config.getString(KEY_MESSAGE_DECODER, DEFAULT_DECODER))
                .brokers(splitBrokers(config.getString(KEY_BROKERS, null)))
                .securityProtocol(parseEnum(SecurityProtocol.class,
                        config.getString(KEY_SECURITY_PROTOCOL, SecurityProtocol.PLAINTEXT.name()), KEY_SECURITY_PROTOCOL))
                .tlsRootCaCerts(config.getString(KEY_TLS_CA_CERTS, null))
                .tlsClientCert(config.getString(KEY_TLS_CLIENT_CERT, null))
                .tlsClientKey(config.getString(KEY_TLS_CLIENT_KEY, null))
                .topic(config.getString(KEY_TOPIC, null))
                .partition(config.getInt(KEY_PARTITION, -1))
                .throughput(config.getInt(KEY_THROUGHPUT, 0))
                .maxOpenRequests(config.getInt(KEY_MAX_OPEN_REQUESTS, DEFAULT_MAX_OPEN_REQUESTS))
                .maxMessageBytes(config.getInt(KEY_MAX_MESSAGE_BYTES, DEFAULT_MAX_MESSAGE_BYTES))
                .requiredAcks(config.getInt(KEY_REQUIRED_ACKS, DEFAULT_REQUIRED_ACKS))
                .timeout(Duration.ofMillis(config.getLong(KEY_TIMEOUT_MS, DEFAULT_TIMEOUT_MS)))
                .partitioner(parseEnum(PartitionerType.class,
                        config.getString(KEY_PARTITIONER, PartitionerType.ROUNDROBIN.name()), KEY_PARTITIONER))
                .compression(parseEnum(CompressionCodec.class,
                        config.getString(KEY_COMPRESSION, CompressionCodec.NONE.name()), KEY_COMPRESSION))
                .flushFrequency(Duration.ofMillis(config.getLong(KEY_FLUSH_FREQUENCY_MS, 0L)))
                .flushBytes(config.getInt(KEY_FLUSH_BYTES, 0))
                .clientId(config.getString(KEY_CLIENT_ID, DEFAULT_CLIENT_ID))
                .routines(config.getInt(KEY_ROUTINES, 1))
                .verbose(config.getBoolean(KEY_VERBOSE, false))
                .reportInterval(Duration.ofSeconds(
                        config.getInt(KEY_REPORT_INTERVAL_SECONDS, DEFAULT_REPORT_INTERVAL_SECONDS)));

        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- Accessors ---

    public DispatchMode mode() { return mode; }
    public boolean sync() { return mode == DispatchMode.SYNC; }
    public int messageLoad() { return messageLoad; }
    public int messageSize() { return messageSize; }
    public String messageFile() { return messageFile; }
    public boolean fileBacked() { return messageFile != null; }
    public String messageDecoder() { return messageDecoder; }
    public List<String> brokers() { return brokers; }
    public SecurityProtocol securityProtocol() { return securityProtocol; }
    public String tlsRootCaCerts() { return tlsRootCaCerts; }
    public String tlsClientCert() { return tlsClientCert; }
    public String tlsClientKey() { return tlsClientKey; }
    public String topic() { return topic; }
    public int partition() { return partition; }
    public int throughput() { return throughput; }
    public int maxOpenRequests() { return maxOpenRequests; }
    public int maxMessageBytes() { return maxMessageBytes; }
    public int requiredAcks() { return requiredAcks; }
    public Duration timeout() { return timeout; }
    public PartitionerType partitioner() { return partitioner; }
    public CompressionCodec compression() { return compression; }
    public Duration flushFrequency() { return flushFrequency; }
    public int flushBytes() { return flushBytes; }
    public String clientId() { return clientId; }
    public int routines() { return routines; }
    public boolean verbose() { return verbose; }
    public Duration reportInterval() { return reportInterval; }

    @Override
    public String toString() {
        return "BenchmarkSettings{" +
                "mode=" + mode +
                ", load=" + messageLoad +
                ", size=" + messageSize +
                ", file=" + messageFile +
                ", decoder=" + messageDecoder +
                ", brokers=" + brokers +
                ", security=" + securityProtocol +
                ", topic='" + topic + '\'' +
                ", partition=" + partition +
                ", throughput=" + throughput +
                ", routines=" + routines +
                ", acks=" + requiredAcks +
                ", partitioner=" + partitioner +
                ", compression=" + compression +
                '}';
    }

    // --- Helpers ---

    private static List<String> splitBrokers(String raw) {
        if (raw == null) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String key) {
        final String v = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, v);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + key + ": '" + raw + "'. Available options: "
                    + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Mutable assembly of settings; {@link #build()} applies every validation rule.
     */
    public static final class Builder {
        private DispatchMode mode = DispatchMode.ASYNC;
        private int messageLoad;
        private int messageSize;
        private String messageFile;
        private String messageDecoder = DEFAULT_DECODER;
        private List<String> brokers = List.of();
        private SecurityProtocol securityProtocol = SecurityProtocol.PLAINTEXT;
        private String tlsRootCaCerts;
        private String tlsClientCert;
        private String tlsClientKey;
        private String topic;
        private int partition = -1;
        private int throughput;
        private int maxOpenRequests = DEFAULT_MAX_OPEN_REQUESTS;
        private int maxMessageBytes = DEFAULT_MAX_MESSAGE_BYTES;
        private int requiredAcks = DEFAULT_REQUIRED_ACKS;
        private Duration timeout = Duration.ofMillis(DEFAULT_TIMEOUT_MS);
        private PartitionerType partitioner = PartitionerType.ROUNDROBIN;
        private CompressionCodec compression = CompressionCodec.NONE;
        private Duration flushFrequency = Duration.ZERO;
        private int flushBytes;
        private String clientId = DEFAULT_CLIENT_ID;
        private int routines = 1;
        private boolean verbose;
        private Duration reportInterval = Duration.ofSeconds(DEFAULT_REPORT_INTERVAL_SECONDS);

        private Builder() {}

        public Builder mode(DispatchMode v) { this.mode = Objects.requireNonNull(v, "mode"); return this; }
        public Builder messageLoad(int v) { this.messageLoad = v; return this; }
        public Builder messageSize(int v) { this.messageSize = v; return this; }
        public Builder messageFile(String v) { this.messageFile = blankToNull(v); return this; }
        public Builder messageDecoder(String v) { this.messageDecoder = v == null ? DEFAULT_DECODER : v.trim(); return this; }
        public Builder brokers(List<String> v) { this.brokers = v == null ? List.of() : v; return this; }
        public Builder securityProtocol(SecurityProtocol v) { this.securityProtocol = Objects.requireNonNull(v, "securityProtocol"); return this; }
        public Builder tlsRootCaCerts(String v) { this.tlsRootCaCerts = blankToNull(v); return this; }
        public Builder tlsClientCert(String v) { this.tlsClientCert = blankToNull(v); return this; }
        public Builder tlsClientKey(String v) { this.tlsClientKey = blankToNull(v); return this; }
        public Builder topic(String v) { this.topic = blankToNull(v); return this; }
        public Builder partition(int v) { this.partition = v; return this; }
        public Builder throughput(int v) { this.throughput = v; return this; }
        public Builder maxOpenRequests(int v) { this.maxOpenRequests = v; return this; }
        public Builder maxMessageBytes(int v) { this.maxMessageBytes = v; return this; }
        public Builder requiredAcks(int v) { this.requiredAcks = v; return this; }
        public Builder timeout(Duration v) { this.timeout = Objects.requireNonNull(v, "timeout"); return this; }
        public Builder partitioner(PartitionerType v) { this.partitioner = Objects.requireNonNull(v, "partitioner"); return this; }
        public Builder compression(CompressionCodec v) { this.compression = Objects.requireNonNull(v, "compression"); return this; }
        public Builder flushFrequency(Duration v) { this.flushFrequency = Objects.requireNonNull(v, "flushFrequency"); return this; }
        public Builder flushBytes(int v) { this.flushBytes = v; return this; }
        public Builder clientId(String v) { this.clientId = v == null ? DEFAULT_CLIENT_ID : v; return this; }
        public Builder routines(int v) { this.routines = v; return this; }
        public Builder verbose(boolean v) { this.verbose = v; return this; }
        public Builder reportInterval(Duration v) { this.reportInterval = Objects.requireNonNull(v, "reportInterval"); return this; }

        public BenchmarkSettings build() {
            if (brokers.isEmpty()) {
                throw new ConfigurationException(KEY_BROKERS + " is required: set it to a comma separated list of broker addresses");
            }
            if (topic == null) {
                throw new ConfigurationException(KEY_TOPIC + " is required: set it to the topic to run the performance test on");
            }
            if (messageLoad <= 0) {
                throw new ConfigurationException(KEY_MESSAGE_LOAD + " must be greater than 0");
            }
            if (messageSize <= 0 && messageFile == null) {
                throw new ConfigurationException("one of " + KEY_MESSAGE_SIZE + " or " + KEY_MESSAGE_FILE + " must be set");
            }
            if (messageSize < 0) {
                throw new ConfigurationException(KEY_MESSAGE_SIZE + " must not be negative");
            }
            if (routines < 1 || routines > messageLoad) {
                throw new ConfigurationException(KEY_ROUTINES + " must be greater than 0 and less than or equal to " + KEY_MESSAGE_LOAD);
            }
            if (throughput < 0) {
                throw new ConfigurationException(KEY_THROUGHPUT + " must be >= 0 (0 for no limit)");
            }
            if (partition < -1) {
                throw new ConfigurationException(KEY_PARTITION + " must be -1 (any) or a partition index");
            }
            if (!KNOWN_DECODERS.contains(messageDecoder.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Unknown " + KEY_MESSAGE_DECODER + ": '" + messageDecoder
                        + "'. Available options: " + KNOWN_DECODERS);
            }
            if (partitioner == PartitionerType.MANUAL && partition < 0) {
                throw new ConfigurationException(KEY_PARTITION + " must not be -1 for " + KEY_PARTITIONER + "=manual");
            }
            if (tlsClientCert != null && tlsClientKey == null) {
                throw new ConfigurationException(KEY_TLS_CLIENT_KEY + " is required when " + KEY_TLS_CLIENT_CERT + " is provided");
            }
            if (requiredAcks < -1 || requiredAcks > 1) {
                throw new ConfigurationException(KEY_REQUIRED_ACKS + " must be -1 (all), 0 (none) or 1 (local)");
            }
            if (maxOpenRequests < 1) {
                throw new ConfigurationException(KEY_MAX_OPEN_REQUESTS + " must be greater than 0");
            }
            if (maxMessageBytes < 1) {
                throw new ConfigurationException(KEY_MAX_MESSAGE_BYTES + " must be greater than 0");
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new ConfigurationException(KEY_TIMEOUT_MS + " must be greater than 0");
            }
            if (flushFrequency.isNegative()) {
                throw new ConfigurationException(KEY_FLUSH_FREQUENCY_MS + " must not be negative");
            }
            if (flushBytes < 0) {
                throw new ConfigurationException(KEY_FLUSH_BYTES + " must not be negative");
            }
            if (reportInterval.isNegative() || reportInterval.isZero()) {
                throw new ConfigurationException(KEY_REPORT_INTERVAL_SECONDS + " must be greater than 0");
            }
            return new BenchmarkSettings(this);
        }

        private static String blankToNull(String s) {
            if (s == null) return null;
            final String t = s.trim();
            return t.isEmpty() ? null : t;
        }
    }
}
