/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.config;

import com.intuitivedesigns.producerperf.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Layered key/value configuration.
 *
 * <p>Precedence, lowest first: properties file ({@code -Dperf.config.path} or env
 * {@code PERF_CONFIG_PATH}), JVM system properties with the {@code perf.} prefix, then
 * {@code key=value} program arguments.
 */
public final class ConfigSource {

    private static final Logger log = LoggerFactory.getLogger(ConfigSource.class);

    public static final String PROP_CONFIG_PATH = "perf.config.path";
    public static final String ENV_CONFIG_PATH = "PERF_CONFIG_PATH";
    private static final String OVERRIDE_PREFIX = "perf.";

    private final Properties props;

    private ConfigSource(Properties props) {
        this.props = props;
    }

    public static ConfigSource of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        final Properties p = new Properties();
        p.putAll(values);
        return new ConfigSource(p);
    }

    /**
     * Builds the layered configuration for a process.
     */
    public static ConfigSource load(String[] args) {
        final Properties p = new Properties();

        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }
        if (path != null && !path.isBlank()) {
            loadFile(Path.of(path.trim()), p);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(OVERRIDE_PREFIX) && !name.equals(PROP_CONFIG_PATH)) {
                p.setProperty(name, System.getProperty(name));
            }
        }

        if (args != null) {
            for (String arg : args) {
                applyArgument(arg, p);
            }
        }
        return new ConfigSource(p);
    }

    private static void loadFile(Path path, Properties into) {
        log.info("Loading configuration from: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            into.load(is);
            log.info("Loaded {} properties.", into.size());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config file " + path
                    + ": check -D" + PROP_CONFIG_PATH + " or " + ENV_CONFIG_PATH, e);
        }
    }

    static void applyArgument(String arg, Properties into) {
        if (arg == null || arg.isBlank()) return;
        String a = arg.trim();
        if (a.startsWith("--")) a = a.substring(2);
        final int eq = a.indexOf('=');
        if (eq <= 0) {
            throw new ConfigurationException("Unrecognized argument '" + arg + "': expected key=value");
        }
        String key = a.substring(0, eq).trim();
        if (!key.startsWith(OVERRIDE_PREFIX) && !key.startsWith("metrics.")) {
            key = OVERRIDE_PREFIX + key;
        }
        into.setProperty(key, a.substring(eq + 1).trim());
    }

    public String getString(String key, String defaultValue) {
        final String v = props.getProperty(key);
        if (v == null) return defaultValue;
        final String t = v.trim();
        return t.isEmpty() ? defaultValue : t;
    }

    public int getInt(String key, int defaultValue) {
        final String val = getString(key, null);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + val + "'", e);
        }
    }

    public long getLong(String key, long defaultValue) {
        final String val = getString(key, null);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + val + "'", e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        final String val = getString(key, null);
        if (val == null) return defaultValue;
        if ("true".equalsIgnoreCase(val)) return true;
        if ("false".equalsIgnoreCase(val)) return false;
        throw new ConfigurationException("'" + key + "' must be true or false, got '" + val + "'");
    }

    public boolean hasPath(String key) {
        return getString(key, null) != null;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
