package com.ckpt.log;

import org.junit.Before;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ModuloPartitionStrategyTest {

    private ModuloPartitionStrategy strategy;

    @Before
    public void setUp() {
        strategy = new ModuloPartitionStrategy();
    }

    @Test
    public void testEventsForOneKeyShareAPartition() {
        int first = strategy.assignPartition("account-123", 6);
        for (int i = 0; i < 50; i++) {
            assertEquals(first, strategy.assignPartition("account-123", 6));
        }
    }

    @Test
    public void testNegativeHashStaysInRange() {
        // "polygenelubricants".hashCode() == Integer.MIN_VALUE
        int partition = strategy.assignPartition("polygenelubricants", 7);
        assertTrue(partition >= 0 && partition < 7);
    }

    @Test
    public void testKeysSpreadOverEveryPartition() {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = 0; i < 600; i++) {
            counts.merge(strategy.assignPartition("account-" + i, 6), 1, Integer::sum);
        }
        assertEquals(6, counts.size());
    }
}
