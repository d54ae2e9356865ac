package com.ckpt.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One epoch of the coordinated manifest: its outcome and the per-worker
 * records acknowledged for it.
 * <p>
 * Encoded as text, one header line {@code epoch|status|createdAt} followed by
 * one encoded {@link SnapshotRecord} per line.
 */
public final class ManifestEntry {

    private final long epoch;
    private final EpochStatus status;
    private final long createdAt;
    private final Map<String, SnapshotRecord> records;

    public ManifestEntry(long epoch, EpochStatus status, long createdAt, Iterable<SnapshotRecord> records) {
        this.epoch = epoch;
        this.status = status;
        this.createdAt = createdAt;
        Map<String, SnapshotRecord> byWorker = new LinkedHashMap<>();
        for (SnapshotRecord record : records) {
            if (record.getGeneration() != epoch) {
                throw new IllegalArgumentException("Record " + record + " does not belong to epoch " + epoch);
            }
            byWorker.put(record.getWorkerId(), record);
        }
        this.records = Collections.unmodifiableMap(byWorker);
    }

    public long getEpoch() {
        return epoch;
    }

    public EpochStatus getStatus() {
        return status;
    }

    public boolean isComplete() {
        return status == EpochStatus.COMPLETE;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Map<String, SnapshotRecord> getRecords() {
        return records;
    }

    public Optional<SnapshotRecord> recordFor(String workerId) {
        return Optional.ofNullable(records.get(workerId));
    }

    public ManifestEntry withoutRecords(Iterable<String> workerIds) {
        Map<String, SnapshotRecord> remaining = new LinkedHashMap<>(records);
        for (String workerId : workerIds) {
            remaining.remove(workerId);
        }
        return new ManifestEntry(epoch, status, createdAt, remaining.values());
    }

    public String encode() {
        StringBuilder sb = new StringBuilder();
        sb.append(epoch).append('|').append(status.name()).append('|').append(createdAt);
        for (SnapshotRecord record : records.values()) {
            sb.append('\n').append(record.encode());
        }
        return sb.toString();
    }

    public static ManifestEntry decode(String value) {
        String[] lines = value.split("\n");
        String[] header = lines[0].split("\\|", -1);
        if (header.length != 3) {
            throw new IllegalArgumentException("Malformed manifest entry header: " + lines[0]);
        }
        List<SnapshotRecord> records = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                records.add(SnapshotRecord.decode(lines[i]));
            }
        }
        return new ManifestEntry(
                Long.parseLong(header[0]),
                EpochStatus.valueOf(header[1]),
                Long.parseLong(header[2]),
                records);
    }

    @Override
    public String toString() {
        return "ManifestEntry{epoch=" + epoch +
                ", status=" + status +
                ", workers=" + records.keySet() + "}";
    }
}
