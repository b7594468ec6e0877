/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.producerperf.kafka;

import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RandomPartitionerTest {

    private static final Node NODE = new Node(0, "localhost", 9092);

    @Test
    void spreadsRecordsOverAvailablePartitions() {
        Cluster cluster = cluster(List.of(
                partition(0, NODE), partition(1, NODE), partition(2, NODE), partition(3, null)));
        RandomPartitioner partitioner = new RandomPartitioner();

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            seen.add(partitioner.partition("bench", null, null, null, new byte[1], cluster));
        }

        // partition 3 has no leader
        assertEquals(Set.of(0, 1, 2), seen);
    }

    @Test
    void fallsBackToAllPartitionsWithoutLeaders() {
        Cluster cluster = cluster(List.of(partition(0, null), partition(1, null)));
        RandomPartitioner partitioner = new RandomPartitioner();

        for (int i = 0; i < 50; i++) {
            int p = partitioner.partition("bench", null, null, null, new byte[1], cluster);
            assertTrue(p == 0 || p == 1, "partition " + p);
        }
    }

    private static PartitionInfo partition(int id, Node leader) {
        return new PartitionInfo("bench", id, leader, new Node[]{NODE}, new Node[]{NODE});
    }

    private static Cluster cluster(List<PartitionInfo> partitions) {
        return new Cluster("test", List.of(NODE), partitions, Set.of(), Set.of());
    }
}
