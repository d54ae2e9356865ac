package com.ckpt.compaction;

import com.ckpt.shared.StrategyType;
import com.ckpt.store.InMemorySnapshotStore;
import com.ckpt.store.SnapshotKeys;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class UncoordinatedCompactorTest {

    private InMemorySnapshotStore store;
    private UncoordinatedCompactor compactor;

    @Before
    public void setUp() {
        store = new InMemorySnapshotStore();
        compactor = new UncoordinatedCompactor(store);
    }

    private void snapshot(String workerId, long sequence) {
        store.put(SnapshotKeys.imageKey(StrategyType.UNCOORDINATED, workerId, sequence), new byte[]{1});
        store.put(SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, workerId, sequence), new byte[]{2});
    }

    @Test
    public void testEachWorkerKeepsOnlyItsLatest() {
        snapshot("a", 1);
        snapshot("a", 2);
        snapshot("a", 3);
        snapshot("b", 1);

        CompactionReport report = compactor.compact();

        assertEquals(4, report.getDeletedKeys().size());
        assertEquals(List.of(SnapshotKeys.recordKey(StrategyType.UNCOORDINATED, "a", 3)),
                store.list(SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED, "a")));
        assertEquals(List.of(SnapshotKeys.imageKey(StrategyType.UNCOORDINATED, "a", 3)),
                store.list(SnapshotKeys.imagePrefix(StrategyType.UNCOORDINATED, "a")));
        assertEquals(1, store.list(SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED, "b")).size());
    }

    @Test
    public void testOrphanedOldImagesRemoved() {
        store.put(SnapshotKeys.imageKey(StrategyType.UNCOORDINATED, "a", 1), new byte[]{1});
        snapshot("a", 2);

        compactor.compact();

        assertEquals(1, store.list(SnapshotKeys.imagePrefix(StrategyType.UNCOORDINATED, "a")).size());
    }

    @Test
    public void testCompactionIsIdempotent() {
        snapshot("a", 1);
        snapshot("a", 2);
        compactor.compact();

        assertTrue(compactor.compact().isEmpty());
    }

    @Test
    public void testCoordinatedDataUntouched() {
        store.put(SnapshotKeys.recordKey(StrategyType.COORDINATED, "a", 1), new byte[]{1});
        snapshot("a", 5);

        assertTrue(compactor.compact().isEmpty());
        assertEquals(1, store.list(SnapshotKeys.recordPrefix(StrategyType.COORDINATED)).size());
    }
}
