package com.ckpt.store;

import org.junit.Test;

import static org.junit.Assert.*;

public class OracleSnapshotStoreTest {

    @Test
    public void testListOrdersByBinaryCollation() {
        assertTrue(OracleSnapshotStore.LIST_SQL.endsWith("ORDER BY NLSSORT(blob_key, 'NLS_SORT=BINARY')"));
        assertFalse(OracleSnapshotStore.LIST_SQL.contains("ORDER BY blob_key"));
    }

    @Test
    public void testEscapeLike() {
        assertEquals("records/uncoordinated/w\\_1/", OracleSnapshotStore.escapeLike("records/uncoordinated/w_1/"));
        assertEquals("a\\%b\\\\c", OracleSnapshotStore.escapeLike("a%b\\c"));
    }
}
