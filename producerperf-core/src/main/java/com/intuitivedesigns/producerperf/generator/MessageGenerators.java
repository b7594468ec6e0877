/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.generator;

import com.intuitivedesigns.producerperf.config.BenchmarkSettings;
import com.intuitivedesigns.producerperf.decode.PayloadDecoder;

import java.nio.file.Path;
import java.util.Objects;

public final class MessageGenerators {

    private MessageGenerators() {}

    /**
     * File-backed when a message file is configured, random otherwise. The decoder scheme is
     * resolved before the file is opened.
     */
    public static MessageGenerator forSettings(BenchmarkSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (settings.fileBacked()) {
            final PayloadDecoder decoder = PayloadDecoder.forScheme(settings.messageDecoder());
            return new FileMessageGenerator(Path.of(settings.messageFile()), decoder);
        }
        return new RandomMessageGenerator(settings.messageSize());
    }
}
