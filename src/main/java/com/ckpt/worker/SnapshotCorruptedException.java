package com.ckpt.worker;

import com.ckpt.shared.CheckpointException;

public class SnapshotCorruptedException extends CheckpointException {

    public SnapshotCorruptedException(String message) {
        super(message);
    }
}
