package com.ckpt.recovery;

import com.ckpt.coordination.WorkerChannel;
import com.ckpt.shared.EpochStatus;
import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import com.ckpt.store.InMemorySnapshotStore;
import com.ckpt.store.ManifestStore;
import com.ckpt.store.SnapshotKeys;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CoordinatedRecoveryManagerTest {

    private InMemorySnapshotStore store;
    private ManifestStore manifestStore;
    private CoordinatedRecoveryManager recoveryManager;

    @Before
    public void setUp() {
        store = new InMemorySnapshotStore();
        manifestStore = new ManifestStore(store, () -> 1L);
        manifestStore.load();
        recoveryManager = new CoordinatedRecoveryManager(manifestStore, store);
    }

    private void epoch(long epoch, EpochStatus status, String... workerIds) {
        while (manifestStore.lastAssignedEpoch() < epoch) {
            manifestStore.reserveNextEpoch();
        }
        List<SnapshotRecord> records = new ArrayList<>();
        for (String workerId : workerIds) {
            String imageKey = SnapshotKeys.imageKey(StrategyType.COORDINATED, workerId, epoch);
            store.put(imageKey, new byte[]{1});
            records.add(new SnapshotRecord(workerId, StrategyType.COORDINATED, epoch, epoch, imageKey, 1, 1L,
                    Map.of(0, epoch * 10)));
        }
        manifestStore.publish(new ManifestEntry(epoch, status, epoch, records));
    }

    @Test(expected = RecoveryInconsistencyException.class)
    public void testEmptyManifestIsFatal() {
        recoveryManager.selectRecoveryPoint();
    }

    @Test
    public void testBaselineMeansFreshStart() {
        manifestStore.initialize();
        RecoveryPoint point = recoveryManager.selectRecoveryPoint();
        assertEquals(0, point.getEpoch().getAsLong());
        assertTrue(recoveryManager.planFor("w1").isFresh());
    }

    @Test
    public void testLatestCompleteEpochChosen() {
        epoch(1, EpochStatus.COMPLETE, "a", "b");
        epoch(2, EpochStatus.COMPLETE, "a", "b");
        epoch(3, EpochStatus.INCOMPLETE);

        RecoveryPoint point = recoveryManager.selectRecoveryPoint();

        assertEquals(2, point.getEpoch().getAsLong());
        assertEquals(Map.of(0, 20L), point.planFor("a").getReplayOffsets());
        assertEquals(2, point.planFor("b").getRecord().get().getGeneration());
    }

    @Test
    public void testEpochWithMissingImageSkipped() {
        epoch(1, EpochStatus.COMPLETE, "a");
        epoch(2, EpochStatus.COMPLETE, "a");
        store.delete(SnapshotKeys.imageKey(StrategyType.COORDINATED, "a", 2));

        assertEquals(1, recoveryManager.selectRecoveryPoint().getEpoch().getAsLong());
    }

    @Test
    public void testWorkerAbsentFromLatestEpochFallsBack() {
        epoch(1, EpochStatus.COMPLETE, "a", "b");
        epoch(2, EpochStatus.COMPLETE, "a");

        RecoveryPoint point = recoveryManager.selectRecoveryPoint();

        assertEquals(2, point.getEpoch().getAsLong());
        assertEquals(1, point.planFor("b").getRecord().get().getGeneration());
        assertTrue(point.planFor("c").isFresh());
    }

    @Test(expected = RecoveryInconsistencyException.class)
    public void testNoIntactEpochIsFatal() {
        epoch(1, EpochStatus.COMPLETE, "a");
        store.delete(SnapshotKeys.imageKey(StrategyType.COORDINATED, "a", 1));
        recoveryManager.selectRecoveryPoint();
    }

    @Test
    public void testPendingRecoveryBookkeeping() {
        epoch(1, EpochStatus.COMPLETE, "a");
        recoveryManager.markForRecovery("a");
        assertTrue(recoveryManager.needsRecovery("a"));

        List<WorkerRecoveryPlan> delivered = new ArrayList<>();
        recoveryManager.recover(new WorkerChannel() {
            @Override
            public String getWorkerId() {
                return "a";
            }

            @Override
            public void requestSnapshot(long epoch) {
            }

            @Override
            public void restore(WorkerRecoveryPlan plan) {
                delivered.add(plan);
            }
        });

        assertEquals(1, delivered.size());
        assertFalse(recoveryManager.needsRecovery("a"));
        assertTrue(recoveryManager.pendingRecovery().isEmpty());
    }
}
