/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.decode.PayloadDecoder;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Cycles through the records of a pre-loaded message file.
 *
 * <p>The whole file is read and decoded in the constructor, so every I/O or decode problem
 * surfaces before any stream is started.
 */
public final class FileMessageGenerator extends AbstractMessageGenerator {

    private final RecordPool pool;

    public FileMessageGenerator(Path messageFile, PayloadDecoder decoder) {
        this(RecordPool.load(messageFile, decoder));
    }

    public FileMessageGenerator(RecordPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    public RecordPool pool() {
        return pool;
    }

    @Override
    protected String describe(GenerationJob job) {
        return "FileMessageGenerator is generating " + job.count() + " messages from " + pool.size() + " records";
    }

    @Override
    protected byte[] payloadAt(int index) {
        return pool.recordFor(index);
    }
}
