/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import com.intuitivedesigns.producerperf.config.ConfigSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void commonTagsComeFromMetricsTagKeys() {
        MetricsSettings settings = MetricsSettings.from(ConfigSource.of(Map.of(
                "metrics.tag.env", "ci",
                "metrics.tag.host", "runner-1",
                "perf.topic", "bench")));

        assertEquals(Map.of("env", "ci", "host", "runner-1"), settings.commonTags());

        try (MicrometerMetricsRuntime runtime = MicrometerMetricsRuntime.fromSettings(settings)) {
            assertEquals("MICROMETER", runtime.type());

            Counter c = runtime.registry().counter("sample");
            c.increment();

            assertEquals("ci", c.getId().getTag("env"));
            assertEquals(1.0, runtime.registry().find("sample").counter().count());
        }
    }

    @Test
    void blankTagsAreDroppedAndTheRestConvertInKeyOrder() {
        MetricsSettings settings = MetricsSettings.from(ConfigSource.of(Map.of(
                "metrics.tag.zone", " eu-1 ",
                "metrics.tag.app", "perf",
                "metrics.tag.empty", "  ",
                "metrics.tag. ", "orphan")));

        assertEquals(Tags.of("app", "perf", "zone", "eu-1"), settings.tags());
        assertEquals(Tags.empty(), MetricsSettings.empty().tags());
    }
}
