package com.ckpt.store;

import java.util.List;

// A put is atomic: readers see the whole value or nothing
public interface SnapshotStore {

    // Lifecycle
    void initialize();

    void close();

    void put(String key, byte[] bytes);

    byte[] get(String key);

    // Keys starting with prefix, in ascending key order
    List<String> list(String prefix);

    // Removing an absent key is a no-op
    void delete(String key);
}
