package com.ckpt.log;

public final class LogEvent {

    private final int partitionId;
    private final long offset;
    private final String key;
    private final String payload;
    private final long timestamp;

    public LogEvent(int partitionId, long offset, String key, String payload, long timestamp) {
        this.partitionId = partitionId;
        this.offset = offset;
        this.key = key;
        this.payload = payload;
        this.timestamp = timestamp;
    }

    public int getPartitionId() {
        return partitionId;
    }

    public long getOffset() {
        return offset;
    }

    public String getKey() {
        return key;
    }

    public String getPayload() {
        return payload;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "LogEvent{partitionId=" + partitionId + ", offset=" + offset +
                ", key='" + key + "', payload='" + payload + "'}";
    }
}
