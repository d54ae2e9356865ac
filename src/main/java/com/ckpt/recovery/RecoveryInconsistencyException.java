package com.ckpt.recovery;

import com.ckpt.shared.CheckpointException;

public class RecoveryInconsistencyException extends CheckpointException {

    public RecoveryInconsistencyException(String message) {
        super(message);
    }
}
