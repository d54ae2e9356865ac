package com.ckpt.worker;

import com.ckpt.log.LogEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

// apply and capture share the lock, so an image never reflects half an event
public class WorkerState {

    private final Map<Integer, Map<String, String>> partitions = new HashMap<>();
    private final Map<Integer, Long> offsets = new HashMap<>();

    public synchronized void apply(LogEvent event, EventProcessor processor) {
        long expected = offsetFor(event.getPartitionId());
        if (event.getOffset() != expected) {
            throw new IllegalStateException("Partition " + event.getPartitionId() + " expected offset " +
                    expected + " but got " + event.getOffset());
        }
        Map<String, String> values = partitions.computeIfAbsent(event.getPartitionId(), p -> new HashMap<>());
        processor.process(event, values);
        offsets.put(event.getPartitionId(), event.getOffset() + 1);
    }

    public synchronized StateImage capture(long timestamp) {
        return new StateImage(partitions, offsets, timestamp);
    }

    public synchronized void install(StateImage image) {
        partitions.clear();
        offsets.clear();
        for (Map.Entry<Integer, Map<String, String>> entry : image.getPartitions().entrySet()) {
            partitions.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        offsets.putAll(image.getOffsets());
    }

    public synchronized long offsetFor(int partitionId) {
        return offsets.getOrDefault(partitionId, 0L);
    }

    public synchronized Map<Integer, Long> offsets() {
        return new TreeMap<>(offsets);
    }

    public synchronized String get(int partitionId, String key) {
        Map<String, String> values = partitions.get(partitionId);
        return values == null ? null : values.get(key);
    }
}
