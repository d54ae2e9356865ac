package com.ckpt.compaction;

import com.ckpt.store.SnapshotStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class StoreCompactor implements Compactor {

    private static final Logger log = LoggerFactory.getLogger(StoreCompactor.class);

    protected final SnapshotStore store;

    StoreCompactor(SnapshotStore store) {
        this.store = store;
    }

    // A failed delete is logged and left for the next run
    protected boolean tryDelete(String key, CompactionReport.Builder report) {
        try {
            store.delete(key);
            report.deleted(key);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to delete {}, will retry on the next compaction run: {}", key, e.getMessage());
            report.failed(key);
            return false;
        }
    }
}
