/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.decode;

import com.intuitivedesigns.producerperf.errors.ConfigurationException;
import com.intuitivedesigns.producerperf.errors.DecodeException;
import com.intuitivedesigns.producerperf.errors.BenchmarkException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PayloadDecoderTest {

    @Test
    void rawReturnsLineBytesUnchanged() {
        assertArrayEquals("hello world".getBytes(StandardCharsets.ISO_8859_1), PayloadDecoder.RAW.decode("hello world"));
    }

    @Test
    void hexDecodesEvenLengthInput() {
        assertArrayEquals(new byte[]{(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef}, PayloadDecoder.HEX.decode("deadBEEF"));
    }

    @Test
    void hexRejectsOddLengthAndNonHexDigits() {
        assertThrows(DecodeException.class, () -> PayloadDecoder.HEX.decode("abc"));
        DecodeException e = assertThrows(DecodeException.class, () -> PayloadDecoder.HEX.decode("zz"));
        assertEquals(BenchmarkException.EXIT_UNAVAILABLE, e.exitStatus());
    }

    @Test
    void base64DecodesToExactLength() {
        // trailing bytes are not padded out to the encoded length
        assertArrayEquals("hi".getBytes(StandardCharsets.US_ASCII), PayloadDecoder.BASE64.decode("aGk="));
    }

    @Test
    void base64RejectsGarbage() {
        assertThrows(DecodeException.class, () -> PayloadDecoder.BASE64.decode("not*base64"));
    }

    @Test
    void base64RejectsMissingOrMisplacedPadding() {
        assertThrows(DecodeException.class, () -> PayloadDecoder.BASE64.decode("aGk"));
        assertThrows(DecodeException.class, () -> PayloadDecoder.BASE64.decode("aG=k"));
        assertThrows(DecodeException.class, () -> PayloadDecoder.BASE64.decode("aGk=="));
        assertThrows(DecodeException.class, () -> PayloadDecoder.BASE64.decode("a==="));
    }

    @Test
    void hexAndBase64RecoverArbitraryBytes() {
        Random random = new Random(20250101L);
        for (int i = 0; i < 500; i++) {
            byte[] original = new byte[random.nextInt(200)];
            random.nextBytes(original);
            assertRecovered(original);
        }
        assertRecovered(new byte[0]);

        byte[] everyByte = new byte[256];
        for (int b = 0; b < everyByte.length; b++) {
            everyByte[b] = (byte) b;
        }
        assertRecovered(everyByte);
    }

    private static void assertRecovered(byte[] original) {
        assertArrayEquals(original, PayloadDecoder.HEX.decode(HexFormat.of().formatHex(original)));
        assertArrayEquals(original, PayloadDecoder.BASE64.decode(Base64.getEncoder().encodeToString(original)));
    }

    @Test
    void forSchemeIsCaseInsensitive() {
        assertSame(PayloadDecoder.HEX, PayloadDecoder.forScheme("HEX"));
        assertSame(PayloadDecoder.BASE64, PayloadDecoder.forScheme("base64"));
        assertEquals("raw", PayloadDecoder.RAW.scheme());
    }

    @Test
    void unknownSchemeIsAConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> PayloadDecoder.forScheme("zlib"));
        assertEquals(BenchmarkException.EXIT_USAGE, e.exitStatus());
        assertTrue(e.getMessage().contains("zlib"));
    }
}
