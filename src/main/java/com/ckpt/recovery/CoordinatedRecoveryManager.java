package com.ckpt.recovery;

import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotManifest;
import com.ckpt.shared.SnapshotRecord;
import com.ckpt.store.ManifestStore;
import com.ckpt.store.SnapshotStore;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class CoordinatedRecoveryManager extends AbstractRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(CoordinatedRecoveryManager.class);

    private final ManifestStore manifestStore;

    @Inject
    public CoordinatedRecoveryManager(ManifestStore manifestStore, SnapshotStore store) {
        super(store);
        this.manifestStore = manifestStore;
    }

    @Override
    public RecoveryPoint selectRecoveryPoint() {
        SnapshotManifest manifest = manifestStore.snapshot();
        if (manifest.isEmpty()) {
            throw new RecoveryInconsistencyException("Manifest has no entries; the store was never initialized");
        }
        List<Long> complete = manifest.completeEpochs();
        for (int i = complete.size() - 1; i >= 0; i--) {
            ManifestEntry entry = manifest.entry(complete.get(i)).get();
            if (!imagesPresent(entry)) {
                log.warn("Complete epoch {} is missing snapshot images, trying an older epoch", entry.getEpoch());
                continue;
            }
            Map<String, WorkerRecoveryPlan> plans = new LinkedHashMap<>();
            for (SnapshotRecord record : entry.getRecords().values()) {
                plans.put(record.getWorkerId(), WorkerRecoveryPlan.from(record));
            }
            for (int j = i - 1; j >= 0; j--) {
                for (SnapshotRecord older : manifest.entry(complete.get(j)).get().getRecords().values()) {
                    if (!plans.containsKey(older.getWorkerId()) && exists(older.getStorageKey())) {
                        plans.put(older.getWorkerId(), WorkerRecoveryPlan.from(older));
                    }
                }
            }
            return RecoveryPoint.coordinated(entry.getEpoch(), plans);
        }
        throw new RecoveryInconsistencyException("No complete epoch with intact images among " + complete);
    }

    private boolean imagesPresent(ManifestEntry entry) {
        for (SnapshotRecord record : entry.getRecords().values()) {
            if (!exists(record.getStorageKey())) {
                return false;
            }
        }
        return true;
    }
}
