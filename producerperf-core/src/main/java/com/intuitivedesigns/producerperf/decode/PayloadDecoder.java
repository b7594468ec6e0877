/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.decode;

import com.intuitivedesigns.producerperf.errors.ConfigurationException;
import com.intuitivedesigns.producerperf.errors.DecodeException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Encodings accepted for lines of a message file.
 *
 * <p>Lines are handled as ISO-8859-1 text: every byte maps to exactly one char, so
 * {@link #RAW} returns the original file bytes unchanged.
 */
public enum PayloadDecoder {

    RAW {
        @Override
        public byte[] decode(String line) {
            return line.getBytes(StandardCharsets.ISO_8859_1);
        }
    },

    HEX {
        @Override
        public byte[] decode(String line) {
            if ((line.length() & 1) != 0) {
                throw new DecodeException("Failed to decode hex message data: odd length " + line.length());
            }
            try {
                return HexFormat.of().parseHex(line);
            } catch (IllegalArgumentException e) {
                throw new DecodeException("Failed to decode hex message data: " + e.getMessage(), e);
            }
        }
    },

    BASE64 {
        @Override
        public byte[] decode(String line) {
            // padding is mandatory; the JDK decoder alone would accept unpadded input
            if (line.length() % 4 != 0) {
                throw new DecodeException("Failed to decode base64 message data: length " + line.length()
                        + " is not a multiple of 4");
            }
            try {
                return Base64.getDecoder().decode(line);
            } catch (IllegalArgumentException e) {
                throw new DecodeException("Failed to decode base64 message data: " + e.getMessage(), e);
            }
        }
    };

    /**
     * @throws DecodeException if the line is not valid for this scheme
     */
    public abstract byte[] decode(String line);

    public String scheme() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a scheme name ({@code raw}, {@code hex}, {@code base64}), ignoring case.
     *
     * @throws ConfigurationException for any other name
     */
    public static PayloadDecoder forScheme(String scheme) {
        Objects.requireNonNull(scheme, "scheme");
        for (PayloadDecoder d : values()) {
            if (d.scheme().equalsIgnoreCase(scheme.trim())) {
                return d;
            }
        }
        throw new ConfigurationException("Unknown message decoder: '" + scheme + "'. Available options: "
                + Arrays.toString(Arrays.stream(values()).map(PayloadDecoder::scheme).toArray()));
    }
}
