package com.ckpt.shared;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ManifestEntryTest {

    private static SnapshotRecord record(String workerId, long epoch) {
        return new SnapshotRecord(workerId, StrategyType.COORDINATED, epoch, 10L, "img-" + workerId + "-" + epoch,
                8, 1L, Map.of(0, epoch));
    }

    @Test
    public void testEncodeDecode() {
        ManifestEntry entry = new ManifestEntry(7, EpochStatus.COMPLETE, 123L, List.of(record("a", 7), record("b", 7)));

        ManifestEntry decoded = ManifestEntry.decode(entry.encode());

        assertEquals(7, decoded.getEpoch());
        assertTrue(decoded.isComplete());
        assertEquals(123L, decoded.getCreatedAt());
        assertEquals(entry.getRecords(), decoded.getRecords());
    }

    @Test
    public void testBaselineHasNoRecords() {
        ManifestEntry baseline = new ManifestEntry(0, EpochStatus.COMPLETE, 1L, List.of());
        ManifestEntry decoded = ManifestEntry.decode(baseline.encode());
        assertTrue(decoded.getRecords().isEmpty());
        assertEquals(0, decoded.getEpoch());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRecordFromAnotherEpochRejected() {
        new ManifestEntry(7, EpochStatus.COMPLETE, 1L, List.of(record("a", 6)));
    }

    @Test
    public void testWithoutRecords() {
        ManifestEntry entry = new ManifestEntry(3, EpochStatus.COMPLETE, 1L, List.of(record("a", 3), record("b", 3)));
        ManifestEntry shrunk = entry.withoutRecords(List.of("a"));
        assertEquals(List.of("b"), List.copyOf(shrunk.getRecords().keySet()));
        assertTrue(shrunk.recordFor("a").isEmpty());
        assertEquals(2, entry.getRecords().size());
    }

    @Test
    public void testManifestLatestCompleteSkipsIncomplete() {
        SnapshotManifest manifest = new SnapshotManifest(Map.of(
                1L, new ManifestEntry(1, EpochStatus.COMPLETE, 1L, List.of(record("a", 1))),
                2L, new ManifestEntry(2, EpochStatus.INCOMPLETE, 2L, List.of())));

        assertEquals(2, manifest.highestEpoch());
        assertEquals(1, manifest.latestComplete().get().getEpoch());
        assertEquals(List.of(1L), manifest.completeEpochs());
    }
}
