package com.ckpt.compaction;

import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotManifest;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import com.ckpt.store.ManifestStore;
import com.ckpt.store.SnapshotKeys;
import com.ckpt.store.SnapshotStore;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compacts epoch snapshots below the horizon. A worker's old record is only
 * removed once the same worker has a record in a complete epoch at or above
 * the horizon, so every worker keeps at least one restorable snapshot.
 * Abandoned epochs older than the latest complete one are removed whole.
 */
@Singleton
public class CoordinatedCompactor extends StoreCompactor {

    private static final Logger log = LoggerFactory.getLogger(CoordinatedCompactor.class);

    private final ManifestStore manifestStore;

    @Inject
    public CoordinatedCompactor(ManifestStore manifestStore, SnapshotStore store) {
        super(store);
        this.manifestStore = manifestStore;
    }

    @Override
    public synchronized CompactionReport compact() {
        SnapshotManifest manifest = manifestStore.snapshot();
        Optional<CompactionHorizon> found = CompactionHorizon.of(manifest);
        if (found.isEmpty()) {
            return CompactionReport.empty();
        }
        CompactionHorizon horizon = found.get();
        CompactionReport.Builder report = new CompactionReport.Builder();

        Set<String> covered = new HashSet<>();
        for (ManifestEntry entry : manifest.entries().tailMap(horizon.getHorizon(), true).values()) {
            if (entry.isComplete()) {
                covered.addAll(entry.getRecords().keySet());
            }
        }

        for (ManifestEntry entry : manifest.entries().headMap(horizon.getLatestComplete(), false).values()) {
            if (!entry.isComplete()) {
                compactEntry(entry, entry.getRecords().keySet(), report);
            } else if (entry.getEpoch() < horizon.getHorizon()) {
                List<String> eligible = new ArrayList<>();
                for (String workerId : entry.getRecords().keySet()) {
                    if (covered.contains(workerId)) {
                        eligible.add(workerId);
                    }
                }
                compactEntry(entry, eligible, report);
            }
        }

        sweepOrphans(horizon.getLatestComplete(), report);
        CompactionReport result = report.build();
        if (!result.isEmpty()) {
            log.info("Compacted below epoch {}: {}", horizon.getHorizon(), result);
        }
        return result;
    }

    private void compactEntry(ManifestEntry entry, Iterable<String> workerIds, CompactionReport.Builder report) {
        List<String> removed = new ArrayList<>();
        for (String workerId : workerIds) {
            SnapshotRecord record = entry.getRecords().get(workerId);
            boolean recordGone = tryDelete(SnapshotKeys.recordKey(record.getStrategy(), workerId,
                    record.getGeneration()), report);
            if (recordGone && tryDelete(record.getStorageKey(), report)) {
                removed.add(workerId);
            }
        }
        ManifestEntry remaining = entry.withoutRecords(removed);
        if (remaining.getRecords().isEmpty()) {
            manifestStore.retire(entry.getEpoch());
            report.retired(entry.getEpoch());
        } else if (!removed.isEmpty()) {
            manifestStore.shrink(remaining);
        }
    }

    // Unreferenced blobs below the latest complete epoch: abandoned epochs and writes that landed after their worker went DEAD
    private void sweepOrphans(long latestComplete, CompactionReport.Builder report) {
        Set<String> referenced = new HashSet<>();
        for (ManifestEntry entry : manifestStore.snapshot().entries().values()) {
            for (SnapshotRecord record : entry.getRecords().values()) {
                referenced.add(record.getStorageKey());
                referenced.add(SnapshotKeys.recordKey(record.getStrategy(), record.getWorkerId(),
                        record.getGeneration()));
            }
        }
        List<String> candidates = new ArrayList<>(store.list(SnapshotKeys.recordPrefix(StrategyType.COORDINATED)));
        candidates.addAll(store.list(SnapshotKeys.imagePrefix(StrategyType.COORDINATED)));
        for (String key : candidates) {
            if (SnapshotKeys.generationOf(key) < latestComplete && !referenced.contains(key)) {
                tryDelete(key, report);
            }
        }
    }
}
