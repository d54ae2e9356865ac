package com.ckpt.store;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class InMemorySnapshotStoreTest {

    private InMemorySnapshotStore store;

    @Before
    public void setUp() {
        store = new InMemorySnapshotStore();
        store.initialize();
    }

    @After
    public void tearDown() {
        store.close();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testPutThenGet() {
        store.put("a/1", bytes("one"));
        assertArrayEquals(bytes("one"), store.get("a/1"));
    }

    @Test
    public void testStoredBytesAreCopied() {
        byte[] value = bytes("one");
        store.put("a/1", value);
        value[0] = 'X';
        assertArrayEquals(bytes("one"), store.get("a/1"));

        store.get("a/1")[0] = 'Y';
        assertArrayEquals(bytes("one"), store.get("a/1"));
    }

    @Test
    public void testGetMissingThrows() {
        try {
            store.get("missing");
            fail("Expected SnapshotNotFoundException");
        } catch (SnapshotNotFoundException e) {
            assertEquals("missing", e.getKey());
        }
    }

    @Test
    public void testListIsOrderedAndPrefixScoped() {
        store.put("records/w1/00000000000000000002", bytes("2"));
        store.put("records/w1/00000000000000000001", bytes("1"));
        store.put("records/w10/00000000000000000001", bytes("x"));
        store.put("snapshots/w1/00000000000000000001.bin", bytes("img"));

        assertEquals(List.of("records/w1/00000000000000000001", "records/w1/00000000000000000002"),
                store.list("records/w1/"));
        assertEquals(3, store.list("records/").size());
        assertTrue(store.list("nothing/").isEmpty());
    }

    @Test
    public void testDeleteIsIdempotent() {
        store.put("k", bytes("v"));
        store.delete("k");
        store.delete("k");
        assertEquals(0, store.size());
    }
}
