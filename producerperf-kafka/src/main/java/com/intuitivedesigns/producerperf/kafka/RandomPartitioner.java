/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.kafka;

import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.PartitionInfo;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Picks a uniformly random partition for every record, preferring partitions with a live leader.
 */
public final class RandomPartitioner implements Partitioner {

    @Override
    public void configure(Map<String, ?> configs) {
    }

    @Override
    public int partition(String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
        final List<PartitionInfo> available = cluster.availablePartitionsForTopic(topic);
        if (!available.isEmpty()) {
            return available.get(ThreadLocalRandom.current().nextInt(available.size())).partition();
        }
        final Integer count = cluster.partitionCountForTopic(topic);
        return ThreadLocalRandom.current().nextInt(count == null ? 1 : Math.max(1, count));
    }

    @Override
    public void close() {
    }
}
