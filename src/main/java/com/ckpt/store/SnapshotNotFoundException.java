package com.ckpt.store;

public class SnapshotNotFoundException extends SnapshotStoreException {

    private final String key;

    public SnapshotNotFoundException(String key) {
        super("No snapshot stored under key " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
