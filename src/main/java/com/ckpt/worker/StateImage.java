package com.ckpt.worker;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public final class StateImage {

    private final Map<Integer, Map<String, String>> partitions;
    private final Map<Integer, Long> offsets;
    private final long capturedAt;

    public StateImage(Map<Integer, Map<String, String>> partitions, Map<Integer, Long> offsets, long capturedAt) {
        Map<Integer, Map<String, String>> copy = new TreeMap<>();
        for (Map.Entry<Integer, Map<String, String>> entry : partitions.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new TreeMap<>(entry.getValue())));
        }
        this.partitions = Collections.unmodifiableMap(copy);
        this.offsets = Collections.unmodifiableMap(new TreeMap<>(offsets));
        this.capturedAt = capturedAt;
    }

    public static StateImage empty() {
        return new StateImage(Map.of(), Map.of(), 0);
    }

    public Map<Integer, Map<String, String>> getPartitions() {
        return partitions;
    }

    public Map<Integer, Long> getOffsets() {
        return offsets;
    }

    public long getCapturedAt() {
        return capturedAt;
    }

    public int keyCount() {
        int count = 0;
        for (Map<String, String> values : partitions.values()) {
            count += values.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "StateImage{partitions=" + partitions.keySet() + ", keys=" + keyCount() +
                ", offsets=" + offsets + "}";
    }
}
