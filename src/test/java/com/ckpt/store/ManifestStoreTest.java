package com.ckpt.store;

import com.ckpt.shared.EpochStatus;
import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ManifestStoreTest {

    private InMemorySnapshotStore store;
    private ManifestStore manifestStore;

    @Before
    public void setUp() {
        store = new InMemorySnapshotStore();
        manifestStore = new ManifestStore(store, () -> 1000L);
        manifestStore.load();
    }

    private static SnapshotRecord record(String workerId, long epoch) {
        return new SnapshotRecord(workerId, StrategyType.COORDINATED, epoch, 1L,
                SnapshotKeys.imageKey(StrategyType.COORDINATED, workerId, epoch), 4, 2L, Map.of(0, 5L));
    }

    @Test
    public void testInitializeWritesBaselineOnce() {
        assertTrue(manifestStore.initialize());
        assertFalse(manifestStore.initialize());

        ManifestEntry baseline = manifestStore.snapshot().entry(0).get();
        assertTrue(baseline.isComplete());
        assertTrue(baseline.getRecords().isEmpty());
    }

    @Test
    public void testEpochNumbersSurviveReload() {
        manifestStore.initialize();
        assertEquals(1, manifestStore.reserveNextEpoch());
        assertEquals(2, manifestStore.reserveNextEpoch());

        ManifestStore reloaded = new ManifestStore(store, () -> 2000L);
        reloaded.load();
        assertEquals(3, reloaded.reserveNextEpoch());
    }

    @Test
    public void testPublishPersistsEntry() {
        manifestStore.initialize();
        long epoch = manifestStore.reserveNextEpoch();
        manifestStore.publish(new ManifestEntry(epoch, EpochStatus.COMPLETE, 5L, List.of(record("w1", epoch))));

        ManifestStore reloaded = new ManifestStore(store);
        reloaded.load();
        assertEquals(epoch, reloaded.snapshot().latestComplete().get().getEpoch());
        assertEquals(record("w1", epoch), reloaded.snapshot().entry(epoch).get().recordFor("w1").get());
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishUnassignedEpochRejected() {
        manifestStore.publish(new ManifestEntry(5, EpochStatus.COMPLETE, 5L, List.of(record("w1", 5))));
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishTwiceRejected() {
        long epoch = manifestStore.reserveNextEpoch();
        manifestStore.publish(new ManifestEntry(epoch, EpochStatus.COMPLETE, 5L, List.of(record("w1", epoch))));
        manifestStore.publish(new ManifestEntry(epoch, EpochStatus.COMPLETE, 5L, List.of(record("w2", epoch))));
    }

    @Test
    public void testShrinkAndRetire() {
        long epoch = manifestStore.reserveNextEpoch();
        ManifestEntry entry = new ManifestEntry(epoch, EpochStatus.COMPLETE, 5L,
                List.of(record("w1", epoch), record("w2", epoch)));
        manifestStore.publish(entry);

        manifestStore.shrink(entry.withoutRecords(List.of("w1")));
        assertEquals(List.of("w2"), List.copyOf(manifestStore.snapshot().entry(epoch).get().getRecords().keySet()));

        manifestStore.retire(epoch);
        assertTrue(manifestStore.snapshot().entry(epoch).isEmpty());
        assertTrue(store.list(SnapshotKeys.MANIFEST_EPOCHS).isEmpty());
    }
}
