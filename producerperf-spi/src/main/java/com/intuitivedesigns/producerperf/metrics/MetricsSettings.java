/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.metrics;

import com.intuitivedesigns.producerperf.config.ConfigSource;
import io.micrometer.core.instrument.Tags;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable configuration container for the metrics runtime.
 */
public final class MetricsSettings {

    private static final String KEY_TAG_PREFIX = "metrics.tag.";

    private final Map<String, String> commonTags;

    private MetricsSettings(Map<String, String> commonTags) {
        this.commonTags = commonTags;
    }

    public static MetricsSettings from(ConfigSource config) {
        Objects.requireNonNull(config, "config");

        final Map<String, String> tags = new TreeMap<>();
        for (String k : config.keys()) {
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            if (tagKey.isEmpty()) continue;

            final String val = config.getString(k, null);
            if (val == null || val.isBlank()) continue;

            tags.put(tagKey, val.trim());
        }
        return new MetricsSettings(Collections.unmodifiableMap(tags));
    }

    public static MetricsSettings empty() {
        return new MetricsSettings(Map.of());
    }

    public Map<String, String> commonTags() {
        return commonTags;
    }

    /**
     * The common tags as Micrometer {@link Tags}, sorted by key. Keys and values are already
     * trimmed and non-blank.
     */
    public Tags tags() {
        Tags out = Tags.empty();
        for (Map.Entry<String, String> e : commonTags.entrySet()) {
            out = out.and(e.getKey(), e.getValue());
        }
        return out;
    }

    @Override
    public String toString() {
        return "MetricsSettings{commonTags=" + commonTags + '}';
    }
}
