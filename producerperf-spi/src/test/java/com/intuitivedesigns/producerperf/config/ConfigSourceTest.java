/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.config;

import com.intuitivedesigns.producerperf.errors.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConfigSourceTest {

    @Test
    void argumentsGainThePerfPrefix() {
        Properties p = new Properties();

        ConfigSource.applyArgument("brokers=a:9092,b:9092", p);
        ConfigSource.applyArgument("--message.load=50", p);
        ConfigSource.applyArgument("perf.topic=bench", p);
        ConfigSource.applyArgument("metrics.tag.env=ci", p);

        assertEquals("a:9092,b:9092", p.getProperty("perf.brokers"));
        assertEquals("50", p.getProperty("perf.message.load"));
        assertEquals("bench", p.getProperty("perf.topic"));
        assertEquals("ci", p.getProperty("metrics.tag.env"));
    }

    @Test
    void argumentWithoutValueIsRejected() {
        assertThrows(ConfigurationException.class, () -> ConfigSource.applyArgument("sync", new Properties()));
        assertThrows(ConfigurationException.class, () -> ConfigSource.applyArgument("=5", new Properties()));
    }

    @Test
    void argumentsOverrideEarlierLayers() {
        ConfigSource config = ConfigSource.load(new String[]{"throughput=10", "throughput=20"});
        assertEquals(20, config.getInt("perf.throughput", 0));
    }

    @Test
    void blankValuesFallBackToDefaults() {
        ConfigSource config = ConfigSource.of(Map.of("perf.topic", "   "));

        assertEquals("fallback", config.getString("perf.topic", "fallback"));
        assertFalse(config.hasPath("perf.topic"));
    }

    @Test
    void typedGettersRejectMalformedValues() {
        ConfigSource config = ConfigSource.of(Map.of(
                "perf.message.load", "lots",
                "perf.sync", "maybe",
                "perf.timeout.ms", "1500"));

        assertThrows(ConfigurationException.class, () -> config.getInt("perf.message.load", 0));
        assertThrows(ConfigurationException.class, () -> config.getBoolean("perf.sync", false));
        assertEquals(1500L, config.getLong("perf.timeout.ms", 0L));
    }
}
