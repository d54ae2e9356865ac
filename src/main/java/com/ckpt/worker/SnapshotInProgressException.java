package com.ckpt.worker;

import com.ckpt.shared.CheckpointException;

public class SnapshotInProgressException extends CheckpointException {

    public SnapshotInProgressException(String workerId) {
        super("Worker " + workerId + " already has a snapshot in progress");
    }
}
