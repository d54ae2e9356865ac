package com.ckpt.recovery;

import com.ckpt.shared.SnapshotRecord;
import com.ckpt.shared.StrategyType;
import com.ckpt.store.ManifestStore;
import com.ckpt.store.SnapshotKeys;
import com.ckpt.store.SnapshotStore;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class UncoordinatedRecoveryManager extends AbstractRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(UncoordinatedRecoveryManager.class);

    private final ManifestStore manifestStore;

    @Inject
    public UncoordinatedRecoveryManager(ManifestStore manifestStore, SnapshotStore store) {
        super(store);
        this.manifestStore = manifestStore;
    }

    @Override
    public RecoveryPoint selectRecoveryPoint() {
        String prefix = SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED);
        List<String> keys = store.list(prefix);
        if (keys.isEmpty() && manifestStore.snapshot().isEmpty()) {
            throw new RecoveryInconsistencyException("No snapshot records and no manifest; the store was never initialized");
        }
        Map<String, WorkerRecoveryPlan> plans = new LinkedHashMap<>();
        for (String workerId : SnapshotKeys.workersUnder(prefix, keys)) {
            SnapshotRecord latest = latestIntact(workerId);
            plans.put(workerId, latest != null ? WorkerRecoveryPlan.from(latest) : WorkerRecoveryPlan.fresh(workerId));
        }
        return RecoveryPoint.uncoordinated(plans);
    }

    private SnapshotRecord latestIntact(String workerId) {
        List<String> keys = store.list(SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED, workerId));
        for (int i = keys.size() - 1; i >= 0; i--) {
            SnapshotRecord record = SnapshotRecord.decode(new String(store.get(keys.get(i)), StandardCharsets.UTF_8));
            if (exists(record.getStorageKey())) {
                return record;
            }
            log.warn("Worker {} snapshot {} has no image, trying an older one", workerId, record.getGeneration());
        }
        return null;
    }
}
