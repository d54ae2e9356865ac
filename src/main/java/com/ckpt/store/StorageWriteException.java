package com.ckpt.store;

public class StorageWriteException extends SnapshotStoreException {

    private final int attempts;

    public StorageWriteException(String key, int attempts, Throwable cause) {
        super("Write of " + key + " failed after " + attempts + " attempt(s)", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
