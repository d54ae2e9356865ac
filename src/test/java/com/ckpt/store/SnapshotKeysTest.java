package com.ckpt.store;

import com.ckpt.shared.StrategyType;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class SnapshotKeysTest {

    @Test
    public void testKeyLayout() {
        assertEquals("snapshots/coordinated/w1/00000000000000000042.bin",
                SnapshotKeys.imageKey(StrategyType.COORDINATED, "w1", 42));
        assertEquals("records/uncoordinated/w1/00000000000000000003",
                SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, "w1", 3));
        assertEquals("manifest/epochs/00000000000000000007", SnapshotKeys.manifestKey(7));
    }

    @Test
    public void testPaddedKeysSortByGeneration() {
        String nine = SnapshotKeys.recordKey(StrategyType.COORDINATED, "w1", 9);
        String ten = SnapshotKeys.recordKey(StrategyType.COORDINATED, "w1", 10);
        assertTrue(nine.compareTo(ten) < 0);
    }

    @Test
    public void testGenerationOf() {
        assertEquals(42, SnapshotKeys.generationOf(SnapshotKeys.imageKey(StrategyType.COORDINATED, "w1", 42)));
        assertEquals(3, SnapshotKeys.generationOf(SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, "w1", 3)));
    }

    @Test
    public void testWorkersUnder() {
        String prefix = SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED);
        List<String> keys = List.of(
                SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, "a", 1),
                SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, "a", 2),
                SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, "b", 1));
        assertEquals(Set.of("a", "b"), SnapshotKeys.workersUnder(prefix, keys));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeGenerationRejected() {
        SnapshotKeys.pad(-1);
    }
}
