package com.ckpt.worker;

import com.ckpt.shared.CheckpointException;

public class SerializationException extends CheckpointException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
