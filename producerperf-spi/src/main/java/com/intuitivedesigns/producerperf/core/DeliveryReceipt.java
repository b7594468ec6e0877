/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.core;

/**
 * Broker acknowledgement for one record.
 */
public record DeliveryReceipt(String topic, int partition, long offset) {
}
