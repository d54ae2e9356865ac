package com.ckpt.shared;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

// Generation is the epoch (coordinated) or the worker's local sequence (uncoordinated). Offsets are the next ones to replay
public final class SnapshotRecord {

    private final String workerId;
    private final StrategyType strategy;
    private final long generation;
    private final long timestamp;
    private final String storageKey;
    private final long size;
    private final long checksum;
    private final Map<Integer, Long> offsets;

    public SnapshotRecord(String workerId, StrategyType strategy, long generation, long timestamp,
                          String storageKey, long size, long checksum, Map<Integer, Long> offsets) {
        this.workerId = validateWorkerId(workerId);
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.generation = generation;
        this.timestamp = timestamp;
        this.storageKey = Objects.requireNonNull(storageKey, "storageKey");
        this.size = size;
        this.checksum = checksum;
        this.offsets = Collections.unmodifiableMap(new TreeMap<>(offsets));
    }

    public static String validateWorkerId(String workerId) {
        Objects.requireNonNull(workerId, "workerId");
        if (workerId.isBlank() || workerId.contains("|") || workerId.contains("/")
                || workerId.contains("\n") || workerId.contains("\r")) {
            throw new IllegalArgumentException("Invalid worker id: '" + workerId + "'");
        }
        return workerId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public long getGeneration() {
        return generation;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public long getSize() {
        return size;
    }

    public long getChecksum() {
        return checksum;
    }

    public Map<Integer, Long> getOffsets() {
        return offsets;
    }

    public String encode() {
        StringBuilder sb = new StringBuilder();
        sb.append(workerId).append('|')
                .append(strategy.name()).append('|')
                .append(generation).append('|')
                .append(timestamp).append('|')
                .append(storageKey).append('|')
                .append(size).append('|')
                .append(checksum).append('|');
        boolean first = true;
        for (Map.Entry<Integer, Long> entry : offsets.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(entry.getKey()).append(':').append(entry.getValue());
            first = false;
        }
        return sb.toString();
    }

    public static SnapshotRecord decode(String value) {
        String[] parts = value.split("\\|", -1);
        if (parts.length != 8) {
            throw new IllegalArgumentException("Malformed snapshot record: " + value);
        }
        Map<Integer, Long> offsets = new TreeMap<>();
        if (!parts[7].isEmpty()) {
            for (String pair : parts[7].split(",")) {
                int sep = pair.indexOf(':');
                if (sep < 0) {
                    throw new IllegalArgumentException("Malformed offset '" + pair + "' in record: " + value);
                }
                offsets.put(Integer.parseInt(pair.substring(0, sep)), Long.parseLong(pair.substring(sep + 1)));
            }
        }
        return new SnapshotRecord(
                parts[0],
                StrategyType.valueOf(parts[1]),
                Long.parseLong(parts[2]),
                Long.parseLong(parts[3]),
                parts[4],
                Long.parseLong(parts[5]),
                Long.parseLong(parts[6]),
                offsets);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SnapshotRecord other)) {
            return false;
        }
        return generation == other.generation
                && timestamp == other.timestamp
                && size == other.size
                && checksum == other.checksum
                && workerId.equals(other.workerId)
                && strategy == other.strategy
                && storageKey.equals(other.storageKey)
                && offsets.equals(other.offsets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, strategy, generation, storageKey, checksum);
    }

    @Override
    public String toString() {
        return "SnapshotRecord{workerId='" + workerId +
                "', strategy=" + strategy +
                ", generation=" + generation +
                ", storageKey='" + storageKey + "'" +
                ", size=" + size +
                ", checksum=" + checksum +
                ", offsets=" + offsets + "}";
    }
}
