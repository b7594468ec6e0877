/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.dispatch;

import java.time.Duration;

/**
 * @param generated messages pulled from generators
 * @param sends calls made to the producer client (differs from {@code generated} for paced sync runs)
 * @param elapsed wall-clock time of the dispatch phase
 */
public record DispatchResult(long generated, long sends, Duration elapsed) {
}
