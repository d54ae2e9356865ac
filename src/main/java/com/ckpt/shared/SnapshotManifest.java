package com.ckpt.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

public final class SnapshotManifest {

    private final NavigableMap<Long, ManifestEntry> entries;

    public SnapshotManifest(Map<Long, ManifestEntry> entries) {
        this.entries = Collections.unmodifiableNavigableMap(new TreeMap<>(entries));
    }

    public static SnapshotManifest empty() {
        return new SnapshotManifest(Map.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public NavigableMap<Long, ManifestEntry> entries() {
        return entries;
    }

    public Optional<ManifestEntry> entry(long epoch) {
        return Optional.ofNullable(entries.get(epoch));
    }

    public long highestEpoch() {
        return entries.isEmpty() ? 0 : entries.lastKey();
    }

    public Optional<ManifestEntry> latestComplete() {
        for (ManifestEntry entry : entries.descendingMap().values()) {
            if (entry.isComplete()) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<Long> completeEpochs() {
        List<Long> result = new ArrayList<>();
        for (ManifestEntry entry : entries.values()) {
            if (entry.isComplete()) {
                result.add(entry.getEpoch());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "SnapshotManifest{epochs=" + entries.keySet() + "}";
    }
}
