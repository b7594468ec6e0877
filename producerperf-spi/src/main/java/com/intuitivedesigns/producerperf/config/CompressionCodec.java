/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.config;

import java.util.Locale;

public enum CompressionCodec {
    NONE,
    GZIP,
    SNAPPY,
    LZ4,
    ZSTD;

    /**
     * Value for the Kafka {@code compression.type} property.
     */
    public String kafkaName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
