package com.ckpt.log;

import com.ckpt.shared.CkptConfig;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Singleton
public class InMemoryEventLog implements EventLog {

    private final PartitionStrategy strategy;
    private final List<List<LogEvent>> partitions;

    @Inject
    public InMemoryEventLog(PartitionStrategy strategy, CkptConfig config) {
        this(strategy, config.getNumPartitions());
    }

    public InMemoryEventLog(PartitionStrategy strategy, int numPartitions) {
        if (numPartitions <= 0) {
            throw new IllegalArgumentException("numPartitions must be > 0");
        }
        this.strategy = strategy;
        this.partitions = new ArrayList<>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            partitions.add(new ArrayList<>());
        }
    }

    @Override
    public int partitionCount() {
        return partitions.size();
    }

    @Override
    public synchronized long append(String key, String payload) {
        int partitionId = strategy.assignPartition(key, partitions.size());
        return appendTo(partitionId, key, payload);
    }

    public synchronized long appendTo(int partitionId, String key, String payload) {
        List<LogEvent> buffer = buffer(partitionId);
        long offset = buffer.size();
        buffer.add(new LogEvent(partitionId, offset, key, payload, System.currentTimeMillis()));
        notifyAll();
        return offset;
    }

    @Override
    public synchronized LogEvent read(int partitionId, long offset) {
        List<LogEvent> buffer = buffer(partitionId);
        if (offset < 0 || offset >= buffer.size()) {
            return null;
        }
        return buffer.get((int) offset);
    }

    @Override
    public synchronized LogEvent poll(int partitionId, long offset, long timeout, TimeUnit unit)
            throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        LogEvent event = read(partitionId, offset);
        while (event == null) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return null;
            }
            wait(remainingMs);
            event = read(partitionId, offset);
        }
        return event;
    }

    @Override
    public synchronized long endOffset(int partitionId) {
        return buffer(partitionId).size();
    }

    private List<LogEvent> buffer(int partitionId) {
        if (partitionId < 0 || partitionId >= partitions.size()) {
            throw new IllegalArgumentException("No partition " + partitionId);
        }
        return partitions.get(partitionId);
    }
}
