package com.ckpt.store;

import com.google.inject.Inject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentSkipListMap<String, byte[]> blobs = new ConcurrentSkipListMap<>();

    @Inject
    public InMemorySnapshotStore() {
    }

    @Override
    public void initialize() {
    }

    @Override
    public void close() {
        blobs.clear();
    }

    @Override
    public void put(String key, byte[] bytes) {
        blobs.put(key, Arrays.copyOf(bytes, bytes.length));
    }

    @Override
    public byte[] get(String key) {
        byte[] value = blobs.get(key);
        if (value == null) {
            throw new SnapshotNotFoundException(key);
        }
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public List<String> list(String prefix) {
        return new ArrayList<>(blobs.subMap(prefix, true, prefix + Character.MAX_VALUE, false).keySet());
    }

    @Override
    public void delete(String key) {
        blobs.remove(key);
    }

    public int size() {
        return blobs.size();
    }
}
