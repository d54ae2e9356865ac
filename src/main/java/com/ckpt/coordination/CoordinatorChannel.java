package com.ckpt.coordination;

import com.ckpt.shared.SnapshotRecord;

public interface CoordinatorChannel {

    void register(String workerId, WorkerChannel channel);

    void heartbeat(String workerId);

    void acknowledge(SnapshotRecord record);

    void reportSnapshotFailure(String workerId, long epoch, String reason);

    void reportLocalSnapshot(SnapshotRecord record);

    void deregister(String workerId);
}
