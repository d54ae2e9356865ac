package com.ckpt.compaction;

import com.ckpt.shared.StrategyType;
import com.ckpt.store.SnapshotKeys;
import com.ckpt.store.SnapshotStore;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

@Singleton
public class UncoordinatedCompactor extends StoreCompactor {

    private static final Logger log = LoggerFactory.getLogger(UncoordinatedCompactor.class);

    @Inject
    public UncoordinatedCompactor(SnapshotStore store) {
        super(store);
    }

    @Override
    public synchronized CompactionReport compact() {
        CompactionReport.Builder report = new CompactionReport.Builder();
        String prefix = SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED);
        for (String workerId : SnapshotKeys.workersUnder(prefix, store.list(prefix))) {
            compactWorker(workerId, report);
        }
        CompactionReport result = report.build();
        if (!result.isEmpty()) {
            log.info("Compacted uncoordinated snapshots: {}", result);
        }
        return result;
    }

    private void compactWorker(String workerId, CompactionReport.Builder report) {
        List<String> records = store.list(SnapshotKeys.recordPrefix(StrategyType.UNCOORDINATED, workerId));
        if (records.isEmpty()) {
            return;
        }
        long latest = SnapshotKeys.generationOf(records.get(records.size() - 1));
        for (String key : records) {
            if (SnapshotKeys.generationOf(key) < latest) {
                tryDelete(key, report);
            }
        }
        for (String key : store.list(SnapshotKeys.imagePrefix(StrategyType.UNCOORDINATED, workerId))) {
            if (SnapshotKeys.generationOf(key) < latest) {
                tryDelete(key, report);
            }
        }
    }
}
