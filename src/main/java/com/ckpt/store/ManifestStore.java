package com.ckpt.store;

import com.ckpt.shared.EpochStatus;
import com.ckpt.shared.ManifestEntry;
import com.ckpt.shared.SnapshotManifest;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.LongSupplier;

@Singleton
public class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    private final SnapshotStore store;
    private final LongSupplier clock;
    private final NavigableMap<Long, ManifestEntry> entries = new TreeMap<>();
    private long lastAssignedEpoch;

    @Inject
    public ManifestStore(SnapshotStore store) {
        this(store, System::currentTimeMillis);
    }

    public ManifestStore(SnapshotStore store, LongSupplier clock) {
        this.store = store;
        this.clock = clock;
    }

    public synchronized void load() {
        entries.clear();
        for (String key : store.list(SnapshotKeys.MANIFEST_EPOCHS)) {
            ManifestEntry entry = ManifestEntry.decode(new String(store.get(key), StandardCharsets.UTF_8));
            entries.put(entry.getEpoch(), entry);
        }
        long counter = 0;
        if (!store.list(SnapshotKeys.MANIFEST_EPOCH_COUNTER).isEmpty()) {
            counter = Long.parseLong(new String(store.get(SnapshotKeys.MANIFEST_EPOCH_COUNTER),
                    StandardCharsets.UTF_8).trim());
        }
        lastAssignedEpoch = Math.max(counter, entries.isEmpty() ? 0 : entries.lastKey());
        log.info("Loaded manifest with {} entries, last assigned epoch {}", entries.size(), lastAssignedEpoch);
    }

    // No-op when the manifest already has entries
    public synchronized boolean initialize() {
        if (!entries.isEmpty()) {
            return false;
        }
        ManifestEntry baseline = new ManifestEntry(0, EpochStatus.COMPLETE, clock.getAsLong(), List.of());
        write(baseline);
        log.info("Initialized empty manifest with baseline epoch 0");
        return true;
    }

    /**
     * Durably reserves the next epoch number. The counter is persisted before
     * the number is handed out, so an epoch is never assigned twice, even
     * across coordinator restarts.
     */
    public synchronized long reserveNextEpoch() {
        long next = lastAssignedEpoch + 1;
        store.put(SnapshotKeys.MANIFEST_EPOCH_COUNTER, Long.toString(next).getBytes(StandardCharsets.UTF_8));
        lastAssignedEpoch = next;
        return next;
    }

    public synchronized void publish(ManifestEntry entry) {
        if (entries.containsKey(entry.getEpoch())) {
            throw new IllegalStateException("Epoch " + entry.getEpoch() + " already has a manifest entry");
        }
        if (entry.getEpoch() > lastAssignedEpoch) {
            throw new IllegalStateException("Epoch " + entry.getEpoch() + " was never assigned");
        }
        write(entry);
    }

    public synchronized void shrink(ManifestEntry entry) {
        ManifestEntry existing = entries.get(entry.getEpoch());
        if (existing == null) {
            throw new IllegalStateException("Epoch " + entry.getEpoch() + " has no manifest entry");
        }
        if (!existing.getRecords().keySet().containsAll(entry.getRecords().keySet())) {
            throw new IllegalArgumentException("Shrunk entry for epoch " + entry.getEpoch() + " adds records");
        }
        write(entry);
    }

    public synchronized void retire(long epoch) {
        if (!entries.containsKey(epoch)) {
            return;
        }
        store.delete(SnapshotKeys.manifestKey(epoch));
        entries.remove(epoch);
    }

    public synchronized SnapshotManifest snapshot() {
        return new SnapshotManifest(entries);
    }

    public synchronized long lastAssignedEpoch() {
        return lastAssignedEpoch;
    }

    private void write(ManifestEntry entry) {
        store.put(SnapshotKeys.manifestKey(entry.getEpoch()), entry.encode().getBytes(StandardCharsets.UTF_8));
        entries.put(entry.getEpoch(), entry);
    }
}
