package com.survey.boothsampling.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClusterCountAllocatorTest {

    private final ClusterCountAllocator allocator = new ClusterCountAllocator();

    @Test
    void testDefaultSampleSize() {
        int clusters = allocator.clustersFor(300);

        assertEquals(12, clusters);
        assertEquals(24, allocator.targetSelected(clusters));
    }

    @Test
    void testSmallRequestsKeepOneCluster() {
        assertEquals(1, allocator.clustersFor(0));
        assertEquals(1, allocator.clustersFor(10));
        assertEquals(1, allocator.clustersFor(25));
        assertEquals(2, allocator.targetSelected(allocator.clustersFor(10)));
    }

    @Test
    void testRoundingToNearest() {
        assertEquals(1, allocator.clustersFor(36));
        assertEquals(2, allocator.clustersFor(38));
        assertEquals(2, allocator.clustersFor(62));
        assertEquals(3, allocator.clustersFor(63));
        assertEquals(200, allocator.clustersFor(5000));
    }
}
