/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.decode.PayloadDecoder;
import com.intuitivedesigns.producerperf.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decoded payloads loaded from a message file, one per non-empty line.
 *
 * <p>Immutable after construction and safe to read from any number of threads.
 */
public final class RecordPool {

    private static final Logger log = LoggerFactory.getLogger(RecordPool.class);

    private final List<byte[]> records;

    private RecordPool(List<byte[]> records) {
        if (records.isEmpty()) {
            throw new ConfigurationException("Message file yielded no records: add at least one non-empty line");
        }
        this.records = Collections.unmodifiableList(records);
    }

    public static RecordPool of(List<byte[]> records) {
        return new RecordPool(new ArrayList<>(Objects.requireNonNull(records, "records")));
    }

    /**
     * Reads {@code file} line by line, skips empty lines and decodes the rest.
     *
     * @throws ConfigurationException if the file cannot be opened or read, or holds no records
     * @throws com.intuitivedesigns.producerperf.errors.DecodeException on the first malformed line
     */
    public static RecordPool load(Path file, PayloadDecoder decoder) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(decoder, "decoder");

        final List<byte[]> records = new ArrayList<>(64);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) continue;
                records.add(decoder.decode(line));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read message file " + file + ": " + e.getMessage(), e);
        }

        log.debug("Loaded {} records from {} (decoder={})", records.size(), file, decoder.scheme());
        return new RecordPool(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Payload for message {@code index}: records are reused cyclically.
     */
    public byte[] recordFor(long index) {
        return records.get((int) (index % records.size()));
    }
}
