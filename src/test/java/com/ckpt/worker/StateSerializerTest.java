package com.ckpt.worker;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class StateSerializerTest {

    private final StateSerializer serializer = new StateSerializer();

    @Test
    public void testImageSurvivesRoundTrip() {
        StateImage image = new StateImage(
                Map.of(0, Map.of("account-1", "10", "account-2", "été"), 3, Map.of()),
                Map.of(0, 42L, 3, 0L),
                777L);

        StateImage decoded = serializer.deserialize(serializer.serialize(image));

        assertEquals(image.getPartitions(), decoded.getPartitions());
        assertEquals(image.getOffsets(), decoded.getOffsets());
        assertEquals(777L, decoded.getCapturedAt());
    }

    @Test
    public void testEmptyImage() {
        StateImage decoded = serializer.deserialize(serializer.serialize(StateImage.empty()));
        assertTrue(decoded.getPartitions().isEmpty());
        assertEquals(0, decoded.keyCount());
    }

    @Test(expected = SerializationException.class)
    public void testNullValueRejected() {
        Map<String, String> values = new HashMap<>();
        values.put("k", null);
        serializer.serialize(new StateImage(Map.of(0, values), Map.of(0, 1L), 0L));
    }

    @Test(expected = SerializationException.class)
    public void testForeignBytesRejected() {
        serializer.deserialize(new byte[]{1, 2, 3, 4, 5, 6});
    }

    @Test(expected = SerializationException.class)
    public void testTruncatedImageRejected() {
        byte[] full = serializer.serialize(new StateImage(Map.of(0, Map.of("k", "v")), Map.of(0, 1L), 0L));
        byte[] truncated = new byte[full.length - 3];
        System.arraycopy(full, 0, truncated, 0, truncated.length);
        serializer.deserialize(truncated);
    }
}
