package com.ckpt.store;

import com.ckpt.shared.CheckpointException;

public class SnapshotStoreException extends CheckpointException {

    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
