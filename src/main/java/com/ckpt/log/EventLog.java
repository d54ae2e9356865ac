package com.ckpt.log;

import java.util.concurrent.TimeUnit;

public interface EventLog {

    int partitionCount();

    long append(String key, String payload);

    // Event at offset, or null if the partition has not reached it yet
    LogEvent read(int partitionId, long offset);

    // Waits up to timeout for the event; null if it has not arrived
    LogEvent poll(int partitionId, long offset, long timeout, TimeUnit unit) throws InterruptedException;

    // Offset the next appended event will receive
    long endOffset(int partitionId);
}
